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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.collect.ImmutableList;
import com.google.common.io.Resources;
import io.grpc.ServerServiceDefinition;
import io.netty.bootstrap.ServerBootstrap;
import io.netty.channel.Channel;
import io.netty.channel.ChannelFuture;
import io.netty.channel.ChannelInitializer;
import io.netty.channel.ChannelOption;
import io.netty.channel.EventLoopGroup;
import io.netty.channel.nio.NioEventLoopGroup;
import io.netty.channel.socket.SocketChannel;
import io.netty.channel.socket.nio.NioServerSocketChannel;
import io.netty.handler.codec.http.HttpContentCompressor;
import io.netty.handler.codec.http.HttpObjectAggregator;
import io.netty.handler.codec.http.HttpServerCodec;
import io.netty.util.concurrent.DefaultThreadFactory;
import java.io.IOException;
import java.net.InetSocketAddress;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;

/**
 * The HTTP/JSON listener. Each request passes through the HTTP codec, response compression,
 * aggregation, CORS and finally the gateway handler, which calls the gRPC server over
 * {@code loopback}.
 */
public final class HttpGateway {
  private static final String DEFAULT_SCHEMA = "message_api.swagger.json";

  private final ImmutableList<GatewayRoute> routes;
  private final CorsHandler corsHandler = new CorsHandler();
  private final GatewayHandler gatewayHandler;
  private final int maxContentLength;
  private final StructuredLogger log;

  @Nullable private EventLoopGroup bossGroup;
  @Nullable private EventLoopGroup workerGroup;
  @Nullable private Channel serverChannel;

  private HttpGateway(io.grpc.Channel loopback, ImmutableList<GatewayRoute> routes,
      byte[] apiSchema, int maxContentLength, StructuredLogger log) {
    this.routes = routes;
    this.maxContentLength = maxContentLength;
    this.log = log;
    this.gatewayHandler =
        new GatewayHandler(loopback, routes, new ApiDocs(apiSchema, log), log);
  }

  /**
   * Creates a gateway for every HTTP-mappable method of {@code services}.
   *
   * @throws IllegalArgumentException if a method's HTTP binding is malformed
   */
  public static HttpGateway create(io.grpc.Channel loopback, List<ServerServiceDefinition> services,
      byte[] apiSchema, int maxContentLength, StructuredLogger log) {
    checkNotNull(loopback, "loopback");
    checkNotNull(apiSchema, "apiSchema");
    checkNotNull(log, "log");
    ImmutableList.Builder<GatewayRoute> routes = ImmutableList.builder();
    for (ServerServiceDefinition service : services) {
      routes.addAll(GatewayRoute.forService(service));
    }
    return new HttpGateway(loopback, routes.build(), apiSchema, maxContentLength, log);
  }

  /** The schema bundled with the server, served when no other is configured. */
  public static byte[] defaultApiSchema() throws IOException {
    return Resources.toByteArray(Resources.getResource(HttpGateway.class, DEFAULT_SCHEMA));
  }

  /** Number of HTTP bindings, fallbacks included. */
  public int routeCount() {
    return routes.size();
  }

  /**
   * Binds the listener.
   *
   * @return the bound address
   * @throws IOException if the address cannot be bound
   */
  public synchronized InetSocketAddress bind(String host, int port) throws IOException {
    checkState(serverChannel == null, "already bound");
    bossGroup = new NioEventLoopGroup(1, new DefaultThreadFactory("xmtp-http-boss", true));
    workerGroup = new NioEventLoopGroup(0, new DefaultThreadFactory("xmtp-http-worker", true));
    ServerBootstrap bootstrap = new ServerBootstrap()
        .group(bossGroup, workerGroup)
        .channel(NioServerSocketChannel.class)
        .childOption(ChannelOption.TCP_NODELAY, true)
        .childHandler(new ChannelInitializer<SocketChannel>() {
          @Override
          protected void initChannel(SocketChannel ch) {
            ch.pipeline()
                .addLast("codec", new HttpServerCodec())
                .addLast("compressor", new HttpContentCompressor())
                .addLast("aggregator", new HttpObjectAggregator(maxContentLength))
                .addLast("cors", corsHandler)
                .addLast("gateway", gatewayHandler);
          }
        });
    ChannelFuture bound = bootstrap.bind(host, port).awaitUninterruptibly();
    if (!bound.isSuccess()) {
      close();
      throw new IOException("creating http listener on " + host + ":" + port, bound.cause());
    }
    serverChannel = bound.channel();
    InetSocketAddress address = (InetSocketAddress) serverChannel.localAddress();
    log.info("http gateway bound", LogField.string("address", address.toString()),
        LogField.of("routes", routes.size()));
    return address;
  }

  /** Completes when the listener closes. */
  public synchronized ChannelFuture closeFuture() {
    checkState(serverChannel != null, "not bound");
    return serverChannel.closeFuture();
  }

  /** Closes the listener and every open connection, then stops the event loops. */
  public synchronized void close() {
    if (serverChannel != null) {
      serverChannel.close().syncUninterruptibly();
    }
    if (workerGroup != null) {
      workerGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
      workerGroup = null;
    }
    if (bossGroup != null) {
      bossGroup.shutdownGracefully(0, 5, TimeUnit.SECONDS).syncUninterruptibly();
      bossGroup = null;
    }
  }
}
