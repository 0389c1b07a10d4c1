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

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import com.google.protobuf.Message;
import io.grpc.CallOptions;
import io.grpc.ClientCall;
import io.grpc.ClientInterceptors;
import io.grpc.Metadata;
import io.grpc.Status;
import io.grpc.StatusException;
import io.grpc.stub.ClientCalls;
import io.grpc.stub.MetadataUtils;
import io.grpc.stub.StreamObserver;
import io.netty.buffer.Unpooled;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelFutureListener;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.SimpleChannelInboundHandler;
import io.netty.handler.codec.http.DefaultHttpContent;
import io.netty.handler.codec.http.DefaultHttpResponse;
import io.netty.handler.codec.http.FullHttpRequest;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpHeaderValues;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.handler.codec.http.HttpVersion;
import io.netty.handler.codec.http.LastHttpContent;
import io.netty.handler.codec.http.QueryStringDecoder;
import java.net.InetSocketAddress;
import java.net.SocketAddress;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;
import org.xmtp.node.api.RequesterInfo;
import org.xmtp.node.api.TelemetryInterceptor;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;

/**
 * Routes HTTP requests to gRPC methods and relays the results as JSON.
 *
 * <p>Calls are issued asynchronously over the loopback channel, so the event loop never waits on
 * a handler. A call whose HTTP connection goes away is cancelled.
 */
@ChannelHandler.Sharable
final class GatewayHandler extends SimpleChannelInboundHandler<FullHttpRequest> {
  static final Metadata.Key<String> AUTHORIZATION_KEY =
      Metadata.Key.of("authorization", Metadata.ASCII_STRING_MARSHALLER);
  static final Metadata.Key<String> X_FORWARDED_HOST_KEY =
      Metadata.Key.of("x-forwarded-host", Metadata.ASCII_STRING_MARSHALLER);

  private final io.grpc.Channel channel;
  private final ImmutableList<GatewayRoute> routes;
  private final ApiDocs docs;
  private final StructuredLogger log;

  GatewayHandler(io.grpc.Channel channel, List<GatewayRoute> routes, ApiDocs docs,
      StructuredLogger log) {
    this.channel = checkNotNull(channel, "channel");
    this.routes = ImmutableList.copyOf(routes);
    this.docs = checkNotNull(docs, "docs");
    this.log = checkNotNull(log, "log");
  }

  @Override
  protected void channelRead0(ChannelHandlerContext ctx, FullHttpRequest request) {
    boolean keepAlive = HttpUtil.isKeepAlive(request);
    if (!request.decoderResult().isSuccess()) {
      HttpResponses.send(ctx, false,
          HttpResponses.error(Status.INVALID_ARGUMENT.withDescription("malformed request")));
      return;
    }
    QueryStringDecoder uri = new QueryStringDecoder(request.uri());
    String path = uri.path();
    if (ApiDocs.handles(path)) {
      HttpResponses.send(ctx, keepAlive, docs.respond(request.method(), path));
      return;
    }

    GatewayRoute route = null;
    Map<String, String> variables = null;
    boolean pathMatched = false;
    for (GatewayRoute candidate : routes) {
      Map<String, String> match = candidate.path().match(path);
      if (match == null) {
        continue;
      }
      pathMatched = true;
      if (candidate.httpMethod().equals(request.method())) {
        route = candidate;
        variables = match;
        break;
      }
    }
    if (route == null) {
      if (pathMatched) {
        HttpResponses.send(ctx, keepAlive, HttpResponses
            .error(Status.UNIMPLEMENTED.withDescription("Method Not Allowed"))
            .setStatus(HttpResponseStatus.METHOD_NOT_ALLOWED));
      } else {
        HttpResponses.send(ctx, keepAlive,
            HttpResponses.error(Status.NOT_FOUND.withDescription("Not Found")));
      }
      return;
    }

    Message message;
    try {
      message = RequestBinder.bind(route, variables, uri.parameters(),
          request.content().toString(StandardCharsets.UTF_8));
    } catch (StatusException e) {
      HttpResponses.send(ctx, keepAlive, HttpResponses.error(e.getStatus()));
      return;
    }

    Metadata headers = forwardedHeaders(request, ctx.channel().remoteAddress());
    ClientCall<Message, Message> call = ClientInterceptors
        .intercept(channel, MetadataUtils.newAttachHeadersInterceptor(headers))
        .newCall(route.method(), CallOptions.DEFAULT);
    if (route.isServerStreaming()) {
      ClientCalls.asyncServerStreamingCall(call, message,
          new StreamingResponder(ctx, keepAlive, call));
    } else {
      ClientCalls.asyncUnaryCall(call, message, new UnaryResponder(ctx, keepAlive, call));
    }
  }

  @Override
  public void exceptionCaught(ChannelHandlerContext ctx, Throwable cause) {
    log.warn("http connection failed",
        LogField.string("peer", String.valueOf(ctx.channel().remoteAddress())),
        LogField.error(cause));
    ctx.close();
  }

  /**
   * The metadata passed on to the gRPC call: credentials, the caller's version headers, and the
   * proxy headers describing the HTTP hop.
   */
  static Metadata forwardedHeaders(FullHttpRequest request, @Nullable SocketAddress peer) {
    Metadata metadata = new Metadata();
    copyHeader(request, HttpHeaderNames.AUTHORIZATION.toString(), metadata, AUTHORIZATION_KEY);
    copyHeader(request, RequesterInfo.CLIENT_VERSION_KEY.name(), metadata,
        RequesterInfo.CLIENT_VERSION_KEY);
    copyHeader(request, RequesterInfo.APP_VERSION_KEY.name(), metadata,
        RequesterInfo.APP_VERSION_KEY);
    String host = request.headers().get(HttpHeaderNames.HOST);
    if (host != null) {
      metadata.put(X_FORWARDED_HOST_KEY, host);
    }
    String forwardedFor = request.headers().get(TelemetryInterceptor.X_FORWARDED_FOR_KEY.name());
    String peerAddress = peerAddress(peer);
    if (peerAddress != null) {
      forwardedFor = forwardedFor == null ? peerAddress : forwardedFor + ", " + peerAddress;
    }
    if (forwardedFor != null) {
      metadata.put(TelemetryInterceptor.X_FORWARDED_FOR_KEY, forwardedFor);
    }
    return metadata;
  }

  private static void copyHeader(
      FullHttpRequest request, String header, Metadata metadata, Metadata.Key<String> key) {
    String value = request.headers().get(header);
    if (value != null) {
      metadata.put(key, value);
    }
  }

  @Nullable
  private static String peerAddress(@Nullable SocketAddress peer) {
    if (peer instanceof InetSocketAddress) {
      InetSocketAddress inet = (InetSocketAddress) peer;
      return inet.getAddress() != null ? inet.getAddress().getHostAddress() : inet.getHostString();
    }
    return null;
  }

  /** Relays one call's results. Cancels the call if the connection closes first. */
  private abstract static class Responder implements StreamObserver<Message> {
    final ChannelHandlerContext ctx;
    final boolean keepAlive;
    private final ChannelFutureListener cancelOnClose;

    Responder(ChannelHandlerContext ctx, boolean keepAlive, final ClientCall<?, ?> call) {
      this.ctx = ctx;
      this.keepAlive = keepAlive;
      this.cancelOnClose = future -> call.cancel("http connection closed", null);
      ctx.channel().closeFuture().addListener(cancelOnClose);
    }

    final void finish() {
      ctx.channel().closeFuture().removeListener(cancelOnClose);
    }
  }

  private static final class UnaryResponder extends Responder {
    @Nullable private Message response;

    UnaryResponder(ChannelHandlerContext ctx, boolean keepAlive, ClientCall<?, ?> call) {
      super(ctx, keepAlive, call);
    }

    @Override
    public void onNext(Message value) {
      response = value;
    }

    @Override
    public void onError(Throwable t) {
      finish();
      HttpResponses.send(ctx, keepAlive, HttpResponses.error(Status.fromThrowable(t)));
    }

    @Override
    public void onCompleted() {
      finish();
      if (response == null) {
        HttpResponses.send(ctx, keepAlive, HttpResponses.error(
            Status.INTERNAL.withDescription("no response message")));
        return;
      }
      HttpResponses.send(ctx, keepAlive,
          HttpResponses.json(HttpResponseStatus.OK, HttpResponses.print(response)));
    }
  }

  /** Writes one {@code {"result": ...}} line per message on a chunked response. */
  private static final class StreamingResponder extends Responder {
    private boolean headersSent;

    StreamingResponder(ChannelHandlerContext ctx, boolean keepAlive, ClientCall<?, ?> call) {
      super(ctx, keepAlive, call);
    }

    @Override
    public void onNext(Message value) {
      sendHeaders();
      writeLine("{\"result\":" + HttpResponses.print(value) + "}");
    }

    @Override
    public void onError(Throwable t) {
      finish();
      Status status = Status.fromThrowable(t);
      if (!headersSent) {
        HttpResponses.send(ctx, keepAlive, HttpResponses.error(status));
        return;
      }
      writeLine("{\"error\":" + HttpResponses.errorJson(status) + "}");
      end();
    }

    @Override
    public void onCompleted() {
      finish();
      sendHeaders();
      end();
    }

    private void sendHeaders() {
      if (headersSent) {
        return;
      }
      headersSent = true;
      HttpResponse response = new DefaultHttpResponse(HttpVersion.HTTP_1_1, HttpResponseStatus.OK);
      response.headers().set(HttpHeaderNames.CONTENT_TYPE, HttpResponses.JSON);
      response.headers().set(HttpHeaderNames.CONNECTION,
          keepAlive ? HttpHeaderValues.KEEP_ALIVE : HttpHeaderValues.CLOSE);
      HttpUtil.setTransferEncodingChunked(response, true);
      ctx.write(response);
    }

    private void writeLine(String line) {
      ctx.writeAndFlush(new DefaultHttpContent(
          Unpooled.copiedBuffer(line + "\n", StandardCharsets.UTF_8)));
    }

    private void end() {
      ChannelFuture done = ctx.writeAndFlush(LastHttpContent.EMPTY_LAST_CONTENT);
      if (!keepAlive) {
        done.addListener(ChannelFutureListener.CLOSE);
      }
    }
  }
}
