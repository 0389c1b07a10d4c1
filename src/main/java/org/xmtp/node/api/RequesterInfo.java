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

package org.xmtp.node.api;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.grpc.Metadata;
import java.util.List;
import javax.annotation.Nullable;
import org.xmtp.node.logging.LogField;

/**
 * Who is calling, as declared by the client in its version headers.
 *
 * <p>Both headers have the form {@code name/version}, e.g. {@code xmtp-js/7.1.0}.
 */
public final class RequesterInfo {
  public static final Metadata.Key<String> CLIENT_VERSION_KEY =
      Metadata.Key.of("x-client-version", Metadata.ASCII_STRING_MARSHALLER);
  public static final Metadata.Key<String> APP_VERSION_KEY =
      Metadata.Key.of("x-app-version", Metadata.ASCII_STRING_MARSHALLER);

  @Nullable private final String clientName;
  @Nullable private final String clientVersion;
  @Nullable private final String appName;
  @Nullable private final String appVersion;

  private RequesterInfo(
      @Nullable String clientName,
      @Nullable String clientVersion,
      @Nullable String appName,
      @Nullable String appVersion) {
    this.clientName = clientName;
    this.clientVersion = clientVersion;
    this.appName = appName;
    this.appVersion = appVersion;
  }

  public static RequesterInfo fromMetadata(Metadata headers) {
    String[] client = parseVersionHeader(headers.get(CLIENT_VERSION_KEY));
    String[] app = parseVersionHeader(headers.get(APP_VERSION_KEY));
    return new RequesterInfo(client[0], client[1], app[0], app[1]);
  }

  private static String[] parseVersionHeader(@Nullable String value) {
    value = Strings.emptyToNull(value == null ? null : value.trim());
    if (value == null) {
      return new String[2];
    }
    int slash = value.indexOf('/');
    if (slash < 0) {
      return new String[] {value, null};
    }
    return new String[] {
        Strings.emptyToNull(value.substring(0, slash)),
        Strings.emptyToNull(value.substring(slash + 1))};
  }

  @Nullable
  public String getClientName() {
    return clientName;
  }

  @Nullable
  public String getClientVersion() {
    return clientVersion;
  }

  @Nullable
  public String getAppName() {
    return appName;
  }

  @Nullable
  public String getAppVersion() {
    return appVersion;
  }

  /** The present fields as {@code client}, {@code client_version}, {@code app}, {@code app_version}. */
  public List<LogField> logFields() {
    ImmutableList.Builder<LogField> fields = ImmutableList.builder();
    if (clientName != null) {
      fields.add(LogField.string("client", clientName));
    }
    if (clientVersion != null) {
      fields.add(LogField.string("client_version", clientVersion));
    }
    if (appName != null) {
      fields.add(LogField.string("app", appName));
    }
    if (appVersion != null) {
      fields.add(LogField.string("app_version", appVersion));
    }
    return fields.build();
  }
}
