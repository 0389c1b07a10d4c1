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

import static com.google.common.base.Preconditions.checkNotNull;

import org.xmtp.node.logging.StructuredLogger;

/** Everything an {@link Authorizer} is built from. */
public final class AuthnConfig {
  private final AuthnOptions options;
  private final RateLimiter limiter;
  private final AllowLister allowLister;
  private final StructuredLogger log;

  public AuthnConfig(
      AuthnOptions options, RateLimiter limiter, AllowLister allowLister, StructuredLogger log) {
    this.options = checkNotNull(options, "options");
    this.limiter = checkNotNull(limiter, "limiter");
    this.allowLister = checkNotNull(allowLister, "allowLister");
    this.log = checkNotNull(log, "log");
  }

  public AuthnOptions getOptions() {
    return options;
  }

  public RateLimiter getLimiter() {
    return limiter;
  }

  public AllowLister getAllowLister() {
    return allowLister;
  }

  public StructuredLogger getLog() {
    return log;
  }
}
