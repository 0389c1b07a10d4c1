/*
 * Copyright 2026 The gRPC Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.xmtp.node.api.authn;

import com.google.common.base.MoreObjects;

/** Switches for caller authentication and the policies it applies. */
public final class AuthnOptions {
  public static final AuthnOptions DISABLED = newBuilder().build();

  private final boolean enabled;
  private final boolean allowListsEnabled;
  private final boolean rateLimitsEnabled;

  private AuthnOptions(Builder builder) {
    this.enabled = builder.enabled;
    this.allowListsEnabled = builder.allowListsEnabled;
    this.rateLimitsEnabled = builder.rateLimitsEnabled;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /** Whether the authn stage is installed in the interceptor chain at all. */
  public boolean isEnabled() {
    return enabled;
  }

  /** Whether callers are checked against the {@link AllowLister}. */
  public boolean isAllowListsEnabled() {
    return allowListsEnabled;
  }

  /** Whether callers are subject to the {@link RateLimiter}. */
  public boolean isRateLimitsEnabled() {
    return rateLimitsEnabled;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("enabled", enabled)
        .add("allowListsEnabled", allowListsEnabled)
        .add("rateLimitsEnabled", rateLimitsEnabled)
        .toString();
  }

  public static final class Builder {
    private boolean enabled;
    private boolean allowListsEnabled;
    private boolean rateLimitsEnabled;

    private Builder() {}

    public Builder setEnabled(boolean enabled) {
      this.enabled = enabled;
      return this;
    }

    public Builder setAllowListsEnabled(boolean allowListsEnabled) {
      this.allowListsEnabled = allowListsEnabled;
      return this;
    }

    public Builder setRateLimitsEnabled(boolean rateLimitsEnabled) {
      this.rateLimitsEnabled = rateLimitsEnabled;
      return this;
    }

    public AuthnOptions build() {
      return new AuthnOptions(this);
    }
  }
}
