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

package org.xmtp.node.tracing;

import static com.google.common.base.Preconditions.checkNotNull;

import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.sdk.OpenTelemetrySdk;
import io.opentelemetry.sdk.common.CompletableResultCode;
import io.opentelemetry.sdk.resources.Resource;
import io.opentelemetry.sdk.trace.SdkTracerProvider;
import io.opentelemetry.sdk.trace.SdkTracerProviderBuilder;
import io.opentelemetry.sdk.trace.SpanProcessor;
import java.io.Closeable;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Process-wide tracing handle. Create it once at startup, pass it to whatever needs to start
 * spans, and close it on the way out:
 *
 * <pre>{@code
 * try (TracingClient tracing = TracingClient.start("xmtp-node", exportProcessor)) {
 *   ApiServer server = new ApiServer(configBuilder.setTracing(tracing).build());
 *   ...
 * }
 * }</pre>
 */
public final class TracingClient implements Closeable {
  private static final Logger logger = Logger.getLogger(TracingClient.class.getName());

  static final String INSTRUMENTATION_SCOPE = "org.xmtp.node";
  private static final AttributeKey<String> SERVICE_NAME = AttributeKey.stringKey("service.name");
  private static final long SHUTDOWN_TIMEOUT_SECONDS = 10;

  private final OpenTelemetry openTelemetry;
  private final Tracer tracer;
  @Nullable
  private final SdkTracerProvider ownedProvider;

  private TracingClient(OpenTelemetry openTelemetry, @Nullable SdkTracerProvider ownedProvider) {
    this.openTelemetry = checkNotNull(openTelemetry, "openTelemetry");
    this.tracer = openTelemetry.getTracer(INSTRUMENTATION_SCOPE);
    this.ownedProvider = ownedProvider;
  }

  /**
   * Boots a tracer provider for {@code serviceName} that reports finished spans to
   * {@code processors}. The returned client owns the provider and shuts it down on close.
   */
  public static TracingClient start(String serviceName, SpanProcessor... processors) {
    checkNotNull(serviceName, "serviceName");
    Resource resource = Resource.getDefault()
        .merge(Resource.create(Attributes.of(SERVICE_NAME, serviceName)));
    SdkTracerProviderBuilder builder = SdkTracerProvider.builder().setResource(resource);
    for (SpanProcessor processor : processors) {
      builder.addSpanProcessor(processor);
    }
    SdkTracerProvider provider = builder.build();
    OpenTelemetrySdk sdk = OpenTelemetrySdk.builder().setTracerProvider(provider).build();
    return new TracingClient(sdk, provider);
  }

  /** Wraps an {@link OpenTelemetry} instance owned by someone else. Closing is a no-op. */
  public static TracingClient create(OpenTelemetry openTelemetry) {
    return new TracingClient(openTelemetry, null);
  }

  public static TracingClient noop() {
    return new TracingClient(OpenTelemetry.noop(), null);
  }

  public OpenTelemetry getOpenTelemetry() {
    return openTelemetry;
  }

  public Tracer getTracer() {
    return tracer;
  }

  /** Flushes and shuts down the tracer provider if this client started it. */
  @Override
  public void close() {
    if (ownedProvider == null) {
      return;
    }
    CompletableResultCode result = ownedProvider.shutdown()
        .join(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS);
    if (!result.isSuccess()) {
      logger.log(Level.WARNING, "Tracer provider did not shut down cleanly");
    }
  }
}
