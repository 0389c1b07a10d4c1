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

import com.google.api.AnnotationsProto;
import com.google.api.HttpRule;
import com.google.common.base.Splitter;
import com.google.protobuf.DescriptorProtos.FileDescriptorProto;
import com.google.protobuf.DescriptorProtos.MethodDescriptorProto;
import com.google.protobuf.DescriptorProtos.MethodOptions;
import com.google.protobuf.DescriptorProtos.ServiceDescriptorProto;
import com.google.protobuf.Descriptors;
import com.google.protobuf.Descriptors.DescriptorValidationException;
import com.google.rpc.ErrorDetailsProto;
import com.google.rpc.ErrorInfo;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor;
import io.grpc.MethodDescriptor.MethodType;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.ServerInterceptors;
import io.grpc.ServerServiceDefinition;
import io.grpc.Status;
import io.grpc.protobuf.ProtoMethodDescriptorSupplier;
import io.grpc.protobuf.ProtoUtils;
import io.grpc.stub.ServerCalls;
import io.grpc.stub.StreamObserver;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import javax.annotation.Nullable;

/**
 * A small {@link ApiService} for tests. Messages are {@link ErrorInfo}s, echoed by their
 * {@code reason}.
 *
 * <ul>
 *   <li>{@code Echo} returns the request, and is also bound to {@code GET /v1/echo/{reason}} and
 *       {@code POST /v1/echo}.
 *   <li>{@code EchoStream} returns one message per comma-separated part of the reason, and fails
 *       with {@code UNAVAILABLE} after the first part when the reason starts with {@code error}.
 *       Bound to {@code GET /v1/echo-stream/{reason}}.
 *   <li>{@code Fail} closes with {@code NOT_FOUND}.
 *   <li>{@code Boom} throws from the handler.
 * </ul>
 */
public final class EchoService implements ApiService {
  public static final String SERVICE_NAME = "xmtp.test.Echo";

  private static final Descriptors.FileDescriptor FILE = buildFile();

  public static final MethodDescriptor<ErrorInfo, ErrorInfo> ECHO =
      method(SERVICE_NAME, "Echo", MethodType.UNARY);
  public static final MethodDescriptor<ErrorInfo, ErrorInfo> ECHO_STREAM =
      method(SERVICE_NAME, "EchoStream", MethodType.SERVER_STREAMING);
  public static final MethodDescriptor<ErrorInfo, ErrorInfo> FAIL =
      method(SERVICE_NAME, "Fail", MethodType.UNARY);
  public static final MethodDescriptor<ErrorInfo, ErrorInfo> BOOM =
      method(SERVICE_NAME, "Boom", MethodType.UNARY);

  private final String serviceName;
  private final AtomicReference<Metadata> lastHeaders = new AtomicReference<>();
  private final AtomicInteger handled = new AtomicInteger();
  private final AtomicBoolean closed = new AtomicBoolean();

  public EchoService() {
    this(SERVICE_NAME);
  }

  /** A copy under another service name, without HTTP bindings. */
  public EchoService(String serviceName) {
    this.serviceName = serviceName;
  }

  public static ErrorInfo message(String reason) {
    return ErrorInfo.newBuilder().setReason(reason).build();
  }

  public static ApiService.Factory factory(final EchoService service) {
    return log -> service;
  }

  @Nullable
  public Metadata lastHeaders() {
    return lastHeaders.get();
  }

  /** Number of calls that reached a handler. */
  public int handledCount() {
    return handled.get();
  }

  public boolean isClosed() {
    return closed.get();
  }

  @Override
  public void close() {
    closed.set(true);
  }

  @Override
  public ServerServiceDefinition bindService() {
    ServerServiceDefinition definition = ServerServiceDefinition.builder(serviceName)
        .addMethod(rename(ECHO), ServerCalls.asyncUnaryCall(
            (ErrorInfo request, StreamObserver<ErrorInfo> responses) -> {
              handled.incrementAndGet();
              responses.onNext(request);
              responses.onCompleted();
            }))
        .addMethod(rename(ECHO_STREAM), ServerCalls.asyncServerStreamingCall(
            (ErrorInfo request, StreamObserver<ErrorInfo> responses) -> {
              handled.incrementAndGet();
              boolean fail = request.getReason().startsWith("error");
              for (String part : Splitter.on(',').split(request.getReason())) {
                responses.onNext(message(part));
                if (fail) {
                  responses.onError(Status.UNAVAILABLE.withDescription("stream broke")
                      .asRuntimeException());
                  return;
                }
              }
              responses.onCompleted();
            }))
        .addMethod(rename(FAIL), ServerCalls.asyncUnaryCall(
            (ErrorInfo request, StreamObserver<ErrorInfo> responses) -> {
              handled.incrementAndGet();
              responses.onError(
                  Status.NOT_FOUND.withDescription("no such thing").asRuntimeException());
            }))
        .addMethod(rename(BOOM), ServerCalls.asyncUnaryCall(
            (ErrorInfo request, StreamObserver<ErrorInfo> responses) -> {
              handled.incrementAndGet();
              throw new IllegalStateException("boom");
            }))
        .build();
    return ServerInterceptors.intercept(definition, new ServerInterceptor() {
      @Override
      public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
          ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
        lastHeaders.set(headers);
        return next.startCall(call, headers);
      }
    });
  }

  private MethodDescriptor<ErrorInfo, ErrorInfo> rename(MethodDescriptor<ErrorInfo, ErrorInfo> m) {
    if (serviceName.equals(SERVICE_NAME)) {
      return m;
    }
    return m.toBuilder()
        .setFullMethodName(
            MethodDescriptor.generateFullMethodName(serviceName, m.getBareMethodName()))
        .setSchemaDescriptor(null)
        .build();
  }

  private static MethodDescriptor<ErrorInfo, ErrorInfo> method(
      String service, final String name, MethodType type) {
    return MethodDescriptor.<ErrorInfo, ErrorInfo>newBuilder()
        .setType(type)
        .setFullMethodName(MethodDescriptor.generateFullMethodName(service, name))
        .setRequestMarshaller(ProtoUtils.marshaller(ErrorInfo.getDefaultInstance()))
        .setResponseMarshaller(ProtoUtils.marshaller(ErrorInfo.getDefaultInstance()))
        .setSchemaDescriptor(new ProtoMethodDescriptorSupplier() {
          @Override
          public Descriptors.MethodDescriptor getMethodDescriptor() {
            return FILE.findServiceByName("Echo").findMethodByName(name);
          }

          @Override
          public Descriptors.ServiceDescriptor getServiceDescriptor() {
            return FILE.findServiceByName("Echo");
          }

          @Override
          public Descriptors.FileDescriptor getFileDescriptor() {
            return FILE;
          }
        })
        .build();
  }

  private static Descriptors.FileDescriptor buildFile() {
    String errorInfo = "." + ErrorInfo.getDescriptor().getFullName();
    FileDescriptorProto file = FileDescriptorProto.newBuilder()
        .setName("xmtp/test/echo.proto")
        .setPackage("xmtp.test")
        .setSyntax("proto3")
        .addDependency(ErrorDetailsProto.getDescriptor().getName())
        .addService(ServiceDescriptorProto.newBuilder()
            .setName("Echo")
            .addMethod(methodProto("Echo", errorInfo, false, HttpRule.newBuilder()
                .setGet("/v1/echo/{reason}")
                .addAdditionalBindings(HttpRule.newBuilder().setPost("/v1/echo").setBody("*"))
                .build()))
            .addMethod(methodProto("EchoStream", errorInfo, true, HttpRule.newBuilder()
                .setGet("/v1/echo-stream/{reason}")
                .build()))
            .addMethod(methodProto("Fail", errorInfo, false, null))
            .addMethod(methodProto("Boom", errorInfo, false, null)))
        .build();
    try {
      return Descriptors.FileDescriptor.buildFrom(
          file, new Descriptors.FileDescriptor[] {ErrorDetailsProto.getDescriptor()});
    } catch (DescriptorValidationException e) {
      throw new AssertionError(e);
    }
  }

  private static MethodDescriptorProto methodProto(
      String name, String type, boolean serverStreaming, @Nullable HttpRule rule) {
    MethodDescriptorProto.Builder method = MethodDescriptorProto.newBuilder()
        .setName(name)
        .setInputType(type)
        .setOutputType(type)
        .setServerStreaming(serverStreaming);
    if (rule != null) {
      method.setOptions(MethodOptions.newBuilder().setExtension(AnnotationsProto.http, rule));
    }
    return method.build();
  }
}
