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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import io.opentelemetry.api.OpenTelemetry;
import java.time.Duration;
import javax.annotation.Nullable;
import org.xmtp.node.api.authn.AllowLister;
import org.xmtp.node.api.authn.Authorizer;
import org.xmtp.node.api.authn.AuthnOptions;
import org.xmtp.node.api.authn.RateLimiter;
import org.xmtp.node.logging.StructuredLogger;
import org.xmtp.node.metrics.MetricsSink;
import org.xmtp.node.tracing.TracingClient;

/** Immutable configuration of an {@link ApiServer}. */
public final class ServerConfig {
  public static final String DEFAULT_ADDRESS = "0.0.0.0";
  public static final int DEFAULT_GRPC_PORT = 5556;
  public static final int DEFAULT_HTTP_PORT = 5555;
  public static final int DEFAULT_MAX_MSG_SIZE = 4 * 1024 * 1024;
  public static final Duration DEFAULT_SHUTDOWN_TIMEOUT = Duration.ofSeconds(30);

  private final String grpcAddress;
  private final int grpcPort;
  private final String httpAddress;
  private final int httpPort;
  private final int maxMsgSize;
  private final Duration shutdownTimeout;
  private final ApiService.Factory messageService;
  @Nullable private final ApiService.Factory mlsService;
  private final boolean enableMls;
  private final AuthnOptions authnOptions;
  @Nullable private final RateLimiter.Factory rateLimiterFactory;
  @Nullable private final Authorizer.Factory authorizerFactory;
  private final AllowLister allowLister;
  private final StructuredLogger logger;
  private final TracingClient tracing;
  private final OpenTelemetry openTelemetry;
  private final MetricsSink metricsSink;
  @Nullable private final byte[] apiSchema;

  private ServerConfig(Builder builder) {
    this.grpcAddress = builder.grpcAddress;
    this.grpcPort = builder.grpcPort;
    this.httpAddress = builder.httpAddress;
    this.httpPort = builder.httpPort;
    this.maxMsgSize = builder.maxMsgSize;
    this.shutdownTimeout = builder.shutdownTimeout;
    this.messageService = builder.messageService;
    this.mlsService = builder.mlsService;
    this.enableMls = builder.enableMls;
    this.authnOptions = builder.authnOptions;
    this.rateLimiterFactory = builder.rateLimiterFactory;
    this.authorizerFactory = builder.authorizerFactory;
    this.allowLister = builder.allowLister;
    this.logger = builder.logger;
    this.tracing = builder.tracing;
    this.openTelemetry = builder.openTelemetry;
    this.metricsSink = builder.metricsSink;
    this.apiSchema = builder.apiSchema;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public String getGrpcAddress() {
    return grpcAddress;
  }

  public int getGrpcPort() {
    return grpcPort;
  }

  public String getHttpAddress() {
    return httpAddress;
  }

  public int getHttpPort() {
    return httpPort;
  }

  /** Largest message, in bytes, the gRPC listener and the gateway accept. */
  public int getMaxMsgSize() {
    return maxMsgSize;
  }

  /** How long {@link ApiServer#close} waits for background tasks before forcing the listener. */
  public Duration getShutdownTimeout() {
    return shutdownTimeout;
  }

  public ApiService.Factory getMessageService() {
    return messageService;
  }

  @Nullable
  public ApiService.Factory getMlsService() {
    return mlsService;
  }

  public boolean isEnableMls() {
    return enableMls;
  }

  public AuthnOptions getAuthnOptions() {
    return authnOptions;
  }

  @Nullable
  public RateLimiter.Factory getRateLimiterFactory() {
    return rateLimiterFactory;
  }

  @Nullable
  public Authorizer.Factory getAuthorizerFactory() {
    return authorizerFactory;
  }

  public AllowLister getAllowLister() {
    return allowLister;
  }

  public StructuredLogger getLogger() {
    return logger;
  }

  public TracingClient getTracing() {
    return tracing;
  }

  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry;
  }

  public MetricsSink getMetricsSink() {
    return metricsSink;
  }

  /** Schema served at {@code /swagger.json}, or {@code null} for the bundled one. */
  @Nullable
  public byte[] getApiSchema() {
    return apiSchema == null ? null : apiSchema.clone();
  }

  public static final class Builder {
    private String grpcAddress = DEFAULT_ADDRESS;
    private int grpcPort = DEFAULT_GRPC_PORT;
    private String httpAddress = DEFAULT_ADDRESS;
    private int httpPort = DEFAULT_HTTP_PORT;
    private int maxMsgSize = DEFAULT_MAX_MSG_SIZE;
    private Duration shutdownTimeout = DEFAULT_SHUTDOWN_TIMEOUT;
    private ApiService.Factory messageService;
    private ApiService.Factory mlsService;
    private boolean enableMls;
    private AuthnOptions authnOptions = AuthnOptions.DISABLED;
    private RateLimiter.Factory rateLimiterFactory;
    private Authorizer.Factory authorizerFactory;
    private AllowLister allowLister = AllowLister.ALLOW_ALL;
    private StructuredLogger logger = StructuredLogger.of(ApiServer.class);
    private TracingClient tracing = TracingClient.noop();
    private OpenTelemetry openTelemetry = OpenTelemetry.noop();
    private MetricsSink metricsSink = MetricsSink.NOOP;
    private byte[] apiSchema;

    private Builder() {}

    public Builder setGrpcAddress(String grpcAddress) {
      this.grpcAddress = checkNotNull(grpcAddress, "grpcAddress");
      return this;
    }

    /** Port of the gRPC listener; 0 picks a free port. */
    public Builder setGrpcPort(int grpcPort) {
      this.grpcPort = grpcPort;
      return this;
    }

    public Builder setHttpAddress(String httpAddress) {
      this.httpAddress = checkNotNull(httpAddress, "httpAddress");
      return this;
    }

    /** Port of the HTTP gateway; 0 picks a free port. */
    public Builder setHttpPort(int httpPort) {
      this.httpPort = httpPort;
      return this;
    }

    public Builder setMaxMsgSize(int maxMsgSize) {
      this.maxMsgSize = maxMsgSize;
      return this;
    }

    public Builder setShutdownTimeout(Duration shutdownTimeout) {
      this.shutdownTimeout = checkNotNull(shutdownTimeout, "shutdownTimeout");
      return this;
    }

    public Builder setMessageService(ApiService.Factory messageService) {
      this.messageService = checkNotNull(messageService, "messageService");
      return this;
    }

    /** The MLS service is only served when this is set and {@link #setEnableMls} is true. */
    public Builder setMlsService(@Nullable ApiService.Factory mlsService) {
      this.mlsService = mlsService;
      return this;
    }

    public Builder setEnableMls(boolean enableMls) {
      this.enableMls = enableMls;
      return this;
    }

    public Builder setAuthnOptions(AuthnOptions authnOptions) {
      this.authnOptions = checkNotNull(authnOptions, "authnOptions");
      return this;
    }

    public Builder setRateLimiterFactory(RateLimiter.Factory rateLimiterFactory) {
      this.rateLimiterFactory = checkNotNull(rateLimiterFactory, "rateLimiterFactory");
      return this;
    }

    public Builder setAuthorizerFactory(Authorizer.Factory authorizerFactory) {
      this.authorizerFactory = checkNotNull(authorizerFactory, "authorizerFactory");
      return this;
    }

    public Builder setAllowLister(AllowLister allowLister) {
      this.allowLister = checkNotNull(allowLister, "allowLister");
      return this;
    }

    public Builder setLogger(StructuredLogger logger) {
      this.logger = checkNotNull(logger, "logger");
      return this;
    }

    public Builder setTracing(TracingClient tracing) {
      this.tracing = checkNotNull(tracing, "tracing");
      return this;
    }

    /** Where the server's gRPC metrics are recorded. */
    public Builder setOpenTelemetry(OpenTelemetry openTelemetry) {
      this.openTelemetry = checkNotNull(openTelemetry, "openTelemetry");
      return this;
    }

    public Builder setMetricsSink(MetricsSink metricsSink) {
      this.metricsSink = checkNotNull(metricsSink, "metricsSink");
      return this;
    }

    public Builder setApiSchema(byte[] apiSchema) {
      this.apiSchema = checkNotNull(apiSchema, "apiSchema").clone();
      return this;
    }

    /**
     * Validates and builds the configuration.
     *
     * @throws IllegalArgumentException if a port or size is out of range, or a required factory is
     *     missing
     */
    public ServerConfig build() {
      checkArgument(grpcPort >= 0 && grpcPort <= 65535, "invalid grpc port: %s", grpcPort);
      checkArgument(httpPort >= 0 && httpPort <= 65535, "invalid http port: %s", httpPort);
      checkArgument(maxMsgSize > 0, "maxMsgSize must be positive: %s", maxMsgSize);
      checkArgument(!shutdownTimeout.isNegative(), "negative shutdown timeout: %s",
          shutdownTimeout);
      checkArgument(messageService != null, "a message service is required");
      if (authnOptions.isEnabled()) {
        checkArgument(rateLimiterFactory != null, "authn requires a rate limiter factory");
        checkArgument(authorizerFactory != null, "authn requires an authorizer factory");
      }
      return new ServerConfig(this);
    }
  }
}
