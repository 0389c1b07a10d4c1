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

package org.xmtp.node.api.gateway;

import static com.google.common.base.Preconditions.checkArgument;

import com.google.api.AnnotationsProto;
import com.google.api.HttpRule;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;
import com.google.protobuf.DescriptorProtos.MethodOptions;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Message;
import io.grpc.MethodDescriptor;
import io.grpc.MethodDescriptor.Marshaller;
import io.grpc.MethodDescriptor.MethodType;
import io.grpc.MethodDescriptor.PrototypeMarshaller;
import io.grpc.ServerMethodDefinition;
import io.grpc.ServerServiceDefinition;
import io.grpc.protobuf.ProtoMethodDescriptorSupplier;
import io.grpc.protobuf.ProtoUtils;
import io.netty.handler.codec.http.HttpMethod;
import java.util.List;
import javax.annotation.Nullable;

/** One HTTP binding of a gRPC method. */
final class GatewayRoute {
  static final String WHOLE_BODY = "*";
  static final String NO_BODY = "";

  private final HttpMethod httpMethod;
  private final PathTemplate path;
  private final String body;
  private final MethodDescriptor<Message, Message> method;
  private final Message requestPrototype;

  GatewayRoute(HttpMethod httpMethod, PathTemplate path, String body,
      MethodDescriptor<Message, Message> method, Message requestPrototype) {
    this.httpMethod = httpMethod;
    this.path = path;
    this.body = body;
    this.method = method;
    this.requestPrototype = requestPrototype;
  }

  HttpMethod httpMethod() {
    return httpMethod;
  }

  PathTemplate path() {
    return path;
  }

  /** {@code "*"} for the whole request, a field name, or empty when the body is not bound. */
  String body() {
    return body;
  }

  /** Client-side descriptor used to issue the call over the loopback channel. */
  MethodDescriptor<Message, Message> method() {
    return method;
  }

  Message requestPrototype() {
    return requestPrototype;
  }

  boolean isServerStreaming() {
    return method.getType() == MethodType.SERVER_STREAMING;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("httpMethod", httpMethod)
        .add("path", path)
        .add("body", body)
        .add("method", method.getFullMethodName())
        .toString();
  }

  /**
   * Builds the routes for every unary and server-streaming protobuf method of {@code service}: the
   * bindings declared with {@code google.api.http}, plus {@code POST /<full method name>}.
   *
   * @throws IllegalArgumentException if a declared binding names a field the request lacks
   */
  static List<GatewayRoute> forService(ServerServiceDefinition service) {
    ImmutableList.Builder<GatewayRoute> routes = ImmutableList.builder();
    for (ServerMethodDefinition<?, ?> definition : service.getMethods()) {
      MethodDescriptor<?, ?> descriptor = definition.getMethodDescriptor();
      MethodType type = descriptor.getType();
      if (type != MethodType.UNARY && type != MethodType.SERVER_STREAMING) {
        continue;
      }
      Message requestPrototype = prototypeOf(descriptor.getRequestMarshaller());
      Message responsePrototype = prototypeOf(descriptor.getResponseMarshaller());
      if (requestPrototype == null || responsePrototype == null) {
        continue;
      }
      MethodDescriptor<Message, Message> method = MethodDescriptor.<Message, Message>newBuilder()
          .setType(type)
          .setFullMethodName(descriptor.getFullMethodName())
          .setRequestMarshaller(ProtoUtils.marshaller(requestPrototype))
          .setResponseMarshaller(ProtoUtils.marshaller(responsePrototype))
          .build();
      HttpRule rule = httpRuleOf(descriptor);
      if (rule != null) {
        addRule(routes, rule, method, requestPrototype);
        for (HttpRule additional : rule.getAdditionalBindingsList()) {
          addRule(routes, additional, method, requestPrototype);
        }
      }
      routes.add(new GatewayRoute(HttpMethod.POST,
          PathTemplate.parse("/" + descriptor.getFullMethodName()), WHOLE_BODY, method,
          requestPrototype));
    }
    return routes.build();
  }

  @Nullable
  private static Message prototypeOf(Marshaller<?> marshaller) {
    if (!(marshaller instanceof PrototypeMarshaller)) {
      return null;
    }
    Object prototype = ((PrototypeMarshaller<?>) marshaller).getMessagePrototype();
    return prototype instanceof Message ? (Message) prototype : null;
  }

  @Nullable
  private static HttpRule httpRuleOf(MethodDescriptor<?, ?> descriptor) {
    Object schema = descriptor.getSchemaDescriptor();
    if (!(schema instanceof ProtoMethodDescriptorSupplier)) {
      return null;
    }
    MethodOptions options =
        ((ProtoMethodDescriptorSupplier) schema).getMethodDescriptor().getOptions();
    return options.hasExtension(AnnotationsProto.http)
        ? options.getExtension(AnnotationsProto.http)
        : null;
  }

  private static void addRule(ImmutableList.Builder<GatewayRoute> routes, HttpRule rule,
      MethodDescriptor<Message, Message> method, Message requestPrototype) {
    HttpMethod httpMethod;
    String template;
    switch (rule.getPatternCase()) {
      case GET:
        httpMethod = HttpMethod.GET;
        template = rule.getGet();
        break;
      case PUT:
        httpMethod = HttpMethod.PUT;
        template = rule.getPut();
        break;
      case POST:
        httpMethod = HttpMethod.POST;
        template = rule.getPost();
        break;
      case DELETE:
        httpMethod = HttpMethod.DELETE;
        template = rule.getDelete();
        break;
      case PATCH:
        httpMethod = HttpMethod.PATCH;
        template = rule.getPatch();
        break;
      case CUSTOM:
        httpMethod = HttpMethod.valueOf(rule.getCustom().getKind());
        template = rule.getCustom().getPath();
        break;
      default:
        return;
    }
    PathTemplate path = PathTemplate.parse(template);
    Descriptor request = requestPrototype.getDescriptorForType();
    for (String variable : path.variableNames()) {
      checkArgument(RequestBinder.findField(request, variable) != null,
          "%s binds unknown field %s of %s", template, variable, request.getFullName());
    }
    String body = rule.getBody();
    checkArgument(body.isEmpty() || body.equals(WHOLE_BODY)
            || RequestBinder.findField(request, body) != null,
        "%s binds its body to unknown field %s of %s", template, body, request.getFullName());
    routes.add(new GatewayRoute(httpMethod, path, body, method, requestPrototype));
  }
}
