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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Stopwatch;
import com.google.common.base.Supplier;
import com.google.common.collect.ImmutableList;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.ServerCall;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.DoubleHistogram;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Records Prometheus-style server metrics for every call: how many started, how many were handled
 * and with which code, and how long handling took.
 */
public final class MetricsInterceptor extends CallOutcomeInterceptor {
  static final String STARTED_TOTAL = "grpc_server_started_total";
  static final String HANDLED_TOTAL = "grpc_server_handled_total";
  static final String HANDLING_SECONDS = "grpc_server_handling_seconds";

  static final AttributeKey<String> GRPC_TYPE = AttributeKey.stringKey("grpc_type");
  static final AttributeKey<String> GRPC_SERVICE = AttributeKey.stringKey("grpc_service");
  static final AttributeKey<String> GRPC_METHOD = AttributeKey.stringKey("grpc_method");
  static final AttributeKey<String> GRPC_CODE = AttributeKey.stringKey("grpc_code");

  private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);

  // Same boundaries as the Prometheus client's default buckets.
  private static final List<Double> LATENCY_BUCKETS =
      ImmutableList.of(0.005, 0.01, 0.025, 0.05, 0.1, 0.25, 0.5, 1.0, 2.5, 5.0, 10.0);

  private final LongCounter started;
  private final LongCounter handled;
  private final DoubleHistogram handlingSeconds;
  private final Supplier<Stopwatch> stopwatchSupplier;

  public MetricsInterceptor(OpenTelemetry openTelemetry) {
    this(checkNotNull(openTelemetry, "openTelemetry").getMeter("org.xmtp.node"),
        Stopwatch::createUnstarted);
  }

  @VisibleForTesting
  MetricsInterceptor(Meter meter, Supplier<Stopwatch> stopwatchSupplier) {
    this.started = meter.counterBuilder(STARTED_TOTAL)
        .setDescription("Total number of RPCs started on the server")
        .build();
    this.handled = meter.counterBuilder(HANDLED_TOTAL)
        .setDescription("Total number of RPCs completed on the server, regardless of success")
        .build();
    this.handlingSeconds = meter.histogramBuilder(HANDLING_SECONDS)
        .setDescription("Response latency of RPCs handled by the server")
        .setUnit("s")
        .setExplicitBucketBoundariesAdvice(LATENCY_BUCKETS)
        .build();
    this.stopwatchSupplier = checkNotNull(stopwatchSupplier, "stopwatchSupplier");
  }

  @Override
  <ReqT, RespT> OutcomeListener callStarted(ServerCall<ReqT, RespT> call, Metadata headers) {
    MethodDescriptor<ReqT, RespT> method = call.getMethodDescriptor();
    String[] names = TelemetryInterceptor.splitMethodName(method.getFullMethodName());
    final Attributes attributes = Attributes.of(
        GRPC_TYPE, typeName(method.getType()),
        GRPC_SERVICE, names[0],
        GRPC_METHOD, names[1]);
    started.add(1, attributes);
    final Stopwatch stopwatch = stopwatchSupplier.get().start();
    return status -> {
      Attributes withCode = attributes.toBuilder()
          .put(GRPC_CODE, status.getCode().name())
          .build();
      handled.add(1, withCode);
      handlingSeconds.record(stopwatch.elapsed(TimeUnit.NANOSECONDS) / NANOS_PER_SECOND, withCode);
    };
  }

  static String typeName(MethodDescriptor.MethodType type) {
    switch (type) {
      case UNARY:
        return "unary";
      case CLIENT_STREAMING:
        return "client_stream";
      case SERVER_STREAMING:
        return "server_stream";
      case BIDI_STREAMING:
        return "bidi_stream";
      default:
        return "unknown";
    }
  }
}
