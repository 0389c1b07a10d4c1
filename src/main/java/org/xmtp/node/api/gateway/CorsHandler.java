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

import com.google.common.base.Joiner;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import io.netty.channel.ChannelDuplexHandler;
import io.netty.channel.ChannelHandler;
import io.netty.channel.ChannelHandlerContext;
import io.netty.channel.ChannelPromise;
import io.netty.handler.codec.http.FullHttpResponse;
import io.netty.handler.codec.http.HttpHeaderNames;
import io.netty.handler.codec.http.HttpMethod;
import io.netty.handler.codec.http.HttpRequest;
import io.netty.handler.codec.http.HttpResponse;
import io.netty.handler.codec.http.HttpResponseStatus;
import io.netty.handler.codec.http.HttpUtil;
import io.netty.util.ReferenceCountUtil;

/**
 * Allows every origin. Preflight requests ({@code OPTIONS} carrying
 * {@code Access-Control-Request-Method}) are answered here and never reach routing.
 */
@ChannelHandler.Sharable
final class CorsHandler extends ChannelDuplexHandler {
  static final ImmutableList<String> ALLOWED_HEADERS = ImmutableList.of(
      "Content-Type",
      "Accept",
      "Authorization",
      "X-Client-Version",
      "X-App-Version",
      "Baggage",
      "DNT",
      "Sec-CH-UA",
      "Sec-CH-UA-Mobile",
      "Sec-CH-UA-Platform",
      "Sentry-Trace",
      "User-Agent");
  static final ImmutableList<String> ALLOWED_METHODS =
      ImmutableList.of("GET", "HEAD", "POST", "PUT", "PATCH", "DELETE");

  private static final Joiner COMMA = Joiner.on(',');

  @Override
  public void channelRead(ChannelHandlerContext ctx, Object msg) throws Exception {
    if (msg instanceof HttpRequest && isPreflight((HttpRequest) msg)) {
      boolean keepAlive = HttpUtil.isKeepAlive((HttpRequest) msg);
      ReferenceCountUtil.release(msg);
      FullHttpResponse response =
          HttpResponses.full(HttpResponseStatus.OK, "text/plain; charset=utf-8", new byte[0]);
      response.headers()
          .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*")
          .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_HEADERS, COMMA.join(ALLOWED_HEADERS))
          .set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_METHODS, COMMA.join(ALLOWED_METHODS));
      HttpResponses.send(ctx, keepAlive, response);
      return;
    }
    super.channelRead(ctx, msg);
  }

  @Override
  public void write(ChannelHandlerContext ctx, Object msg, ChannelPromise promise)
      throws Exception {
    if (msg instanceof HttpResponse) {
      ((HttpResponse) msg).headers().set(HttpHeaderNames.ACCESS_CONTROL_ALLOW_ORIGIN, "*");
    }
    super.write(ctx, msg, promise);
  }

  private static boolean isPreflight(HttpRequest request) {
    return HttpMethod.OPTIONS.equals(request.method())
        && !Strings.isNullOrEmpty(
            request.headers().get(HttpHeaderNames.ACCESS_CONTROL_REQUEST_METHOD));
  }
}
