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

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.context.Context;
import io.opentelemetry.context.Scope;
import org.xmtp.node.logging.LogField;

/**
 * Runs work inside spans so that failures end up on the trace instead of disappearing.
 */
public final class Tracing {
  static final String TRACE_ID_KEY = "trace_id";
  static final String SPAN_ID_KEY = "span_id";

  private Tracing() {}

  /**
   * Executes {@code action} in a new span named {@code spanName}, a child of {@code parent}.
   *
   * <p>The span is ended exactly once. If the action throws, the throwable is recorded on the span,
   * the span status is set to {@link StatusCode#ERROR}, and the same throwable is rethrown. This
   * method never swallows a failure; containment is the caller's job.
   */
  public static void run(
      TracingClient client, Context parent, String spanName, TracedAction action)
      throws Exception {
    checkNotNull(client, "client");
    checkNotNull(parent, "parent");
    checkNotNull(action, "action");
    Span span = client.getTracer().spanBuilder(spanName).setParent(parent).startSpan();
    Context ctx = parent.with(span);
    try (Scope scope = ctx.makeCurrent()) {
      action.run(ctx);
    } catch (Throwable t) {
      span.recordException(t);
      span.setStatus(StatusCode.ERROR, t.getClass().getName());
      throw t;
    } finally {
      span.end();
    }
  }

  /** Log fields that link a log line to the given span. */
  public static LogField[] traceFields(SpanContext spanContext) {
    if (!spanContext.isValid()) {
      return new LogField[0];
    }
    return new LogField[] {
        LogField.string(TRACE_ID_KEY, spanContext.getTraceId()),
        LogField.string(SPAN_ID_KEY, spanContext.getSpanId()),
    };
  }
}
