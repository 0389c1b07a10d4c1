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

package org.xmtp.node.metrics;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableSet;
import io.opentelemetry.api.OpenTelemetry;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.common.AttributesBuilder;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.Meter;
import java.util.List;
import org.xmtp.node.logging.LogField;

/**
 * Counts API requests with OpenTelemetry.
 *
 * <p>Only low-cardinality fields become attributes. Client IPs and free-form error text are left
 * to the logs.
 */
public final class OpenTelemetryMetricsSink implements MetricsSink {
  static final String METER_NAME = "org.xmtp.node";
  static final String API_REQUESTS = "xmtp_api_requests";

  static final ImmutableSet<String> ATTRIBUTE_KEYS = ImmutableSet.of(
      "service", "method", "client", "client_version", "app", "app_version", "error_code");

  private final LongCounter apiRequests;

  public OpenTelemetryMetricsSink(OpenTelemetry openTelemetry) {
    this(checkNotNull(openTelemetry, "openTelemetry").getMeter(METER_NAME));
  }

  OpenTelemetryMetricsSink(Meter meter) {
    this.apiRequests = meter.counterBuilder(API_REQUESTS)
        .setDescription("Number of completed API requests")
        .setUnit("{request}")
        .build();
  }

  @Override
  public void emitApiRequest(List<LogField> fields) {
    AttributesBuilder attributes = Attributes.builder();
    for (LogField field : fields) {
      if (ATTRIBUTE_KEYS.contains(field.key()) && field.value() != null) {
        attributes.put(field.key(), field.renderedValue());
      }
    }
    apiRequests.add(1, attributes.build());
  }
}
