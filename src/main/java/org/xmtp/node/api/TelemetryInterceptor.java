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
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import javax.annotation.Nullable;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;
import org.xmtp.node.metrics.MetricsSink;

/**
 * Emits one structured record per API call, to the log and to the {@link MetricsSink}.
 *
 * <p>A record carries the service and method, the requester's declared client and app versions,
 * the originating client IP and, when the call failed, the error with its gRPC code. Telemetry
 * never fails a call: problems while building or emitting a record are logged and dropped.
 */
public final class TelemetryInterceptor {
  public static final Metadata.Key<String> X_FORWARDED_FOR_KEY =
      Metadata.Key.of("x-forwarded-for", Metadata.ASCII_STRING_MARSHALLER);

  static final String UNKNOWN = "unknown";
  static final String MESSAGE = "api request";

  private static final Splitter COMMA = Splitter.on(',').trimResults();

  private final StructuredLogger log;
  private final MetricsSink metrics;

  public TelemetryInterceptor(StructuredLogger log, MetricsSink metrics) {
    this.log = checkNotNull(log, "log");
    this.metrics = checkNotNull(metrics, "metrics");
  }

  /** Records every unary call with its final status. */
  public ServerInterceptor unary() {
    return new CallOutcomeInterceptor() {
      @Override
      <ReqT, RespT> OutcomeListener callStarted(ServerCall<ReqT, RespT> call, Metadata headers) {
        String fullMethodName = call.getMethodDescriptor().getFullMethodName();
        return status -> record(headers, fullMethodName, errorOf(status));
      }
    };
  }

  /** Records every streaming call. The outcome of a stream is not reported as an error. */
  public ServerInterceptor stream() {
    return new CallOutcomeInterceptor() {
      @Override
      <ReqT, RespT> OutcomeListener callStarted(ServerCall<ReqT, RespT> call, Metadata headers) {
        String fullMethodName = call.getMethodDescriptor().getFullMethodName();
        return status -> record(headers, fullMethodName, null);
      }
    };
  }

  @Nullable
  private static Throwable errorOf(Status status) {
    if (status.isOk()) {
      return null;
    }
    // Keeps the code and description; the application exception, if any, stays the cause.
    return status.asRuntimeException();
  }

  @VisibleForTesting
  void record(Metadata headers, String fullMethodName, @Nullable Throwable error) {
    List<LogField> fields;
    try {
      fields = buildFields(headers, fullMethodName, error);
    } catch (RuntimeException e) {
      log.debug("failed to build api request record",
          LogField.string("method", fullMethodName), LogField.error(e));
      return;
    }
    Level level = error == null ? Level.FINE : Level.INFO;
    try {
      log.log(level, MESSAGE, fields);
    } catch (RuntimeException e) {
      log.debug("failed to log api request", LogField.error(e));
    }
    try {
      metrics.emitApiRequest(fields);
    } catch (RuntimeException e) {
      log.debug("failed to emit api request metric", LogField.error(e));
    }
  }

  private static List<LogField> buildFields(
      Metadata headers, String fullMethodName, @Nullable Throwable error) {
    String[] names = splitMethodName(fullMethodName);
    List<LogField> fields = new ArrayList<>();
    fields.add(LogField.string("service", names[0]));
    fields.add(LogField.string("method", names[1]));
    fields.addAll(RequesterInfo.fromMetadata(headers).logFields());
    String clientIp = clientIp(headers);
    if (clientIp != null) {
      fields.add(LogField.string("client_ip", clientIp));
    }
    if (error != null) {
      Status status = Status.fromThrowable(error);
      String message = status.getDescription();
      if (message == null && status.getCause() != null) {
        message = status.getCause().getMessage();
      }
      if (message == null) {
        message = Strings.nullToEmpty(error.getMessage());
      }
      fields.add(LogField.error(error));
      fields.add(LogField.string("error_code", status.getCode().name()));
      fields.add(LogField.string("error_message", message));
    }
    return fields;
  }

  /** The first hop of {@code x-forwarded-for}, which is the originating client. */
  @Nullable
  static String clientIp(Metadata headers) {
    String forwardedFor = headers.get(X_FORWARDED_FOR_KEY);
    if (forwardedFor == null) {
      return null;
    }
    return Strings.emptyToNull(COMMA.split(forwardedFor).iterator().next());
  }

  /**
   * Splits {@code /pkg.Service/Method} (leading slash optional) into service and method. Names
   * without a separator yield {@code "unknown"} for both.
   */
  static String[] splitMethodName(String fullMethodName) {
    String name = fullMethodName.startsWith("/") ? fullMethodName.substring(1) : fullMethodName;
    int slash = name.indexOf('/');
    if (slash < 0) {
      return new String[] {UNKNOWN, UNKNOWN};
    }
    return new String[] {name.substring(0, slash), name.substring(slash + 1)};
  }
}
