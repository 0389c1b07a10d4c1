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

import static com.google.common.truth.Truth.assertThat;
import static org.junit.Assert.assertThrows;

import com.google.common.collect.ImmutableList;
import com.google.rpc.ErrorInfo;
import io.grpc.CallOptions;
import io.grpc.ManagedChannel;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.Status;
import io.grpc.StatusRuntimeException;
import io.grpc.inprocess.InProcessChannelBuilder;
import io.grpc.inprocess.InProcessServerBuilder;
import io.grpc.stub.ClientCalls;
import io.grpc.testing.GrpcCleanupRule;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;

/** Unit tests for {@link InterceptorChain}. */
@RunWith(JUnit4.class)
public class InterceptorChainTest {
  @Rule
  public final GrpcCleanupRule grpcCleanup = new GrpcCleanupRule();

  private final List<String> visits = new CopyOnWriteArrayList<>();
  private final EchoService service = new EchoService();

  private ServerInterceptor visiting(final String label) {
    return new ServerInterceptor() {
      @Override
      public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
          ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        visits.add(label);
        return next.startCall(call, headers);
      }
    };
  }

  private static final ServerInterceptor DENY_ALL = new ServerInterceptor() {
    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
      call.close(Status.PERMISSION_DENIED.withDescription("wallet not allowed"), new Metadata());
      return new ServerCall.Listener<ReqT>() {};
    }
  };

  private ManagedChannel serve(InterceptorChain chain) throws Exception {
    String serverName = InProcessServerBuilder.generateName();
    grpcCleanup.register(InProcessServerBuilder.forName(serverName).directExecutor()
        .addService(ServerInterceptors.intercept(service.bindService(),
            chain.asServerInterceptor()))
        .build().start());
    return grpcCleanup.register(
        InProcessChannelBuilder.forName(serverName).directExecutor().build());
  }

  @Test
  public void namesAndFormsKeepInsertionOrder() {
    ServerInterceptor unaryA = visiting("a");
    ServerInterceptor streamA = visiting("A");
    ServerInterceptor unaryB = visiting("b");
    ServerInterceptor streamB = visiting("B");

    InterceptorChain chain = InterceptorChain.newBuilder()
        .add("metrics", unaryA, streamA)
        .add("telemetry", unaryB, streamB)
        .build();

    assertThat(chain.names()).containsExactly("metrics", "telemetry").inOrder();
    assertThat(chain.unaryInterceptors()).containsExactly(unaryA, unaryB).inOrder();
    assertThat(chain.streamInterceptors()).containsExactly(streamA, streamB).inOrder();
  }

  @Test
  public void firstEntryRunsOutermost() throws Exception {
    ManagedChannel channel = serve(InterceptorChain.newBuilder()
        .add("metrics", visiting("metrics-unary"), visiting("metrics-stream"))
        .add("telemetry", visiting("telemetry-unary"), visiting("telemetry-stream"))
        .add("authn", visiting("authn-unary"), visiting("authn-stream"))
        .build());

    ClientCalls.blockingUnaryCall(
        channel, EchoService.ECHO, CallOptions.DEFAULT, EchoService.message("hi"));
    assertThat(visits)
        .containsExactly("metrics-unary", "telemetry-unary", "authn-unary").inOrder();

    visits.clear();
    Iterator<ErrorInfo> responses = ClientCalls.blockingServerStreamingCall(
        channel, EchoService.ECHO_STREAM, CallOptions.DEFAULT, EchoService.message("a"));
    assertThat(ImmutableList.copyOf(responses)).hasSize(1);
    assertThat(visits)
        .containsExactly("metrics-stream", "telemetry-stream", "authn-stream").inOrder();
  }

  @Test
  public void rejectedCallIsStillRecorded() throws Exception {
    List<List<LogField>> emitted = new CopyOnWriteArrayList<>();
    TelemetryInterceptor telemetry = new TelemetryInterceptor(
        StructuredLogger.of(InterceptorChainTest.class), emitted::add);
    ManagedChannel channel = serve(InterceptorChain.newBuilder()
        .add("telemetry", telemetry.unary(), telemetry.stream())
        .add("authn", DENY_ALL, DENY_ALL)
        .build());

    StatusRuntimeException e = assertThrows(StatusRuntimeException.class,
        () -> ClientCalls.blockingUnaryCall(
            channel, EchoService.ECHO, CallOptions.DEFAULT, EchoService.message("hi")));

    assertThat(e.getStatus().getCode()).isEqualTo(Status.Code.PERMISSION_DENIED);
    assertThat(service.handledCount()).isEqualTo(0);
    assertThat(emitted).hasSize(1);
    assertThat(emitted.get(0)).contains(LogField.string("error_code", "PERMISSION_DENIED"));
    assertThat(emitted.get(0)).contains(LogField.string("error_message", "wallet not allowed"));
  }

  @Test
  public void emptyChainPassesThrough() throws Exception {
    ManagedChannel channel = serve(InterceptorChain.newBuilder().build());

    ErrorInfo response = ClientCalls.blockingUnaryCall(
        channel, EchoService.ECHO, CallOptions.DEFAULT, EchoService.message("hi"));

    assertThat(response.getReason()).isEqualTo("hi");
  }

  @Test
  public void duplicateNamesRejected() {
    InterceptorChain.Builder builder =
        InterceptorChain.newBuilder().add("metrics", DENY_ALL, DENY_ALL);

    assertThrows(IllegalArgumentException.class,
        () -> builder.add("metrics", DENY_ALL, DENY_ALL));
  }
}
