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
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.net.HostAndPort;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.grpc.Context;
import io.grpc.ManagedChannel;
import io.grpc.Server;
import io.grpc.ServerServiceDefinition;
import io.grpc.health.v1.HealthCheckResponse.ServingStatus;
import io.grpc.netty.NettyChannelBuilder;
import io.grpc.netty.NettyServerBuilder;
import io.grpc.protobuf.services.HealthStatusManager;
import io.netty.channel.ChannelFuture;
import java.io.Closeable;
import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import javax.annotation.Nullable;
import org.xmtp.node.api.authn.Authorizer;
import org.xmtp.node.api.authn.AuthnConfig;
import org.xmtp.node.api.authn.AuthnOptions;
import org.xmtp.node.api.authn.RateLimiter;
import org.xmtp.node.api.gateway.HttpGateway;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;
import org.xmtp.node.tracing.TaskGroup;

/**
 * Serves the API on two listeners: gRPC, and an HTTP/JSON gateway that forwards to the gRPC
 * listener over a loopback channel. Every gRPC call, including those arriving through the
 * gateway, passes the server's {@link InterceptorChain}.
 *
 * <p>Both serve loops, and the rate limiter's janitor when authentication is enabled, run as
 * {@link TaskGroup} tasks. {@link #close} returns only once all of them have finished.
 */
public final class ApiServer implements Closeable {

  public enum State {
    UNSTARTED,
    STARTING_GRPC,
    STARTING_HTTP,
    RUNNING,
    CLOSING,
    CLOSED,
    FAILED
  }

  static final Duration JANITOR_SWEEP_INTERVAL = Duration.ofMinutes(10);
  static final Duration JANITOR_EXPIRY = Duration.ofHours(1);

  private final ServerConfig config;
  private final StructuredLogger log;
  private final Context.CancellableContext lifecycle = Context.ROOT.withCancellation();
  private final TaskGroup tasks;
  private final HealthStatusManager health = new HealthStatusManager();

  private final Object lock = new Object();
  @GuardedBy("lock")
  private State state = State.UNSTARTED;

  // Written by start() before the state leaves STARTING_*, read afterwards.
  private final List<ApiService> services = new ArrayList<>();
  private ImmutableList<ServerServiceDefinition> serviceDefinitions = ImmutableList.of();
  @Nullable private InterceptorChain chain;
  @Nullable private Server grpcServer;
  @Nullable private ManagedChannel loopback;
  @Nullable private HttpGateway gateway;
  @Nullable private volatile InetSocketAddress grpcAddress;
  @Nullable private volatile InetSocketAddress httpAddress;

  public ApiServer(ServerConfig config) {
    this.config = checkNotNull(config, "config");
    this.log = config.getLogger();
    this.tasks = new TaskGroup(
        config.getTracing(), io.opentelemetry.context.Context.root(), log);
  }

  /**
   * Starts both listeners. On failure everything opened so far is closed again and the server
   * moves to {@link State#FAILED}.
   *
   * @throws IOException if a service cannot be created or a listener cannot be bound
   * @throws IllegalStateException if the server was already started
   */
  public void start() throws IOException {
    synchronized (lock) {
      checkState(state == State.UNSTARTED, "server cannot be started in state %s", state);
      state = State.STARTING_GRPC;
    }
    try {
      startGrpc();
      setState(State.STARTING_HTTP);
      startHttp();
      setState(State.RUNNING);
    } catch (IOException | RuntimeException | Error e) {
      log.error("starting api server", LogField.error(e));
      shutdown();
      setState(State.FAILED);
      throw e;
    }
  }

  private void startGrpc() throws IOException {
    services.add(config.getMessageService().create(log.named("message")));
    if (config.getMlsService() != null && config.isEnableMls()) {
      services.add(config.getMlsService().create(log.named("mls")));
    }
    ImmutableList.Builder<ServerServiceDefinition> definitions = ImmutableList.builder();
    for (ApiService service : services) {
      definitions.add(service.bindService());
    }
    serviceDefinitions = definitions.build();
    chain = buildInterceptorChain();

    NettyServerBuilder builder = NettyServerBuilder
        .forAddress(new InetSocketAddress(config.getGrpcAddress(), config.getGrpcPort()))
        .maxInboundMessageSize(config.getMaxMsgSize())
        .addService(health.getHealthService())
        .intercept(chain.asServerInterceptor());
    for (ServerServiceDefinition definition : serviceDefinitions) {
      builder.addService(definition);
    }
    Server server = builder.build();
    try {
      server.start();
    } catch (IOException e) {
      server.shutdownNow();
      throw new IOException("creating grpc listener", e);
    }
    grpcServer = server;
    grpcAddress = (InetSocketAddress) server.getListenSockets().get(0);
    for (ServerServiceDefinition definition : serviceDefinitions) {
      health.setStatus(definition.getServiceDescriptor().getName(), ServingStatus.SERVING);
    }

    final InetSocketAddress address = grpcAddress;
    tasks.go("grpc", ctx -> {
      log.info("serving grpc", LogField.string("address", address.toString()));
      try {
        server.awaitTermination();
      } catch (InterruptedException e) {
        log.warn("serving grpc interrupted", LogField.error(e));
        Thread.currentThread().interrupt();
      }
    });
  }

  private void startHttp() throws IOException {
    InetSocketAddress target = grpcAddress;
    if (target.getAddress() != null && target.getAddress().isAnyLocalAddress()) {
      target = new InetSocketAddress(InetAddress.getLoopbackAddress(), target.getPort());
    }
    loopback = NettyChannelBuilder.forAddress(target)
        .usePlaintext()
        .maxInboundMessageSize(config.getMaxMsgSize())
        .build();

    byte[] apiSchema = config.getApiSchema();
    gateway = HttpGateway.create(loopback, serviceDefinitions,
        apiSchema != null ? apiSchema : HttpGateway.defaultApiSchema(),
        config.getMaxMsgSize(), log.named("gateway"));
    InetSocketAddress address = gateway.bind(config.getHttpAddress(), config.getHttpPort());
    httpAddress = address;

    final ChannelFuture closed = gateway.closeFuture();
    tasks.go("http", ctx -> {
      log.info("serving http", LogField.string("address", address.toString()));
      closed.await();
      log.info("http listener closed", LogField.string("address", address.toString()));
    });
  }

  /**
   * Assembles metrics, then telemetry, then (when enabled) authentication. With authentication
   * the rate limiter is created here and its janitor spawned.
   */
  @VisibleForTesting
  InterceptorChain buildInterceptorChain() {
    MetricsInterceptor metrics = new MetricsInterceptor(config.getOpenTelemetry());
    TelemetryInterceptor telemetry = new TelemetryInterceptor(log, config.getMetricsSink());
    InterceptorChain.Builder builder = InterceptorChain.newBuilder()
        .add("metrics", metrics, metrics)
        .add("telemetry", telemetry.unary(), telemetry.stream());

    AuthnOptions authn = config.getAuthnOptions();
    if (authn.isEnabled()) {
      final RateLimiter limiter =
          config.getRateLimiterFactory().create(lifecycle, log.named("ratelimiter"));
      // Buckets idle for an hour are dropped, with a sweep every ten minutes.
      tasks.go("ratelimiter-janitor",
          ctx -> limiter.janitor(JANITOR_SWEEP_INTERVAL, JANITOR_EXPIRY));
      Authorizer authorizer = config.getAuthorizerFactory().create(
          new AuthnConfig(authn, limiter, config.getAllowLister(), log.named("authn")));
      builder.add("authn", authorizer.unary(), authorizer.stream());
    }
    return builder.build();
  }

  /**
   * Shuts the server down: business services first, then the HTTP listener, the loopback channel
   * and the gRPC listener, then waits for every background task. Errors are logged. Calling this
   * more than once, or after a failed start, has no further effect. A close that arrives while
   * {@link #start} is still binding waits for it to finish first.
   */
  @Override
  public void close() {
    boolean interrupted = false;
    synchronized (lock) {
      while (state == State.STARTING_GRPC || state == State.STARTING_HTTP) {
        try {
          lock.wait();
        } catch (InterruptedException e) {
          interrupted = true;
        }
      }
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
      if (state == State.CLOSING || state == State.CLOSED || state == State.FAILED) {
        return;
      }
      if (state == State.UNSTARTED) {
        state = State.CLOSED;
        return;
      }
      state = State.CLOSING;
    }
    log.info("closing");
    shutdown();
    setState(State.CLOSED);
    log.info("closed");
  }

  private void shutdown() {
    for (ApiService service : services) {
      try {
        service.close();
      } catch (IOException | RuntimeException e) {
        log.error("closing service", LogField.error(e));
      }
    }
    health.enterTerminalState();

    if (gateway != null) {
      try {
        gateway.close();
      } catch (RuntimeException e) {
        log.error("closing http listener", LogField.error(e));
      }
    }
    if (loopback != null) {
      loopback.shutdownNow();
    }
    if (grpcServer != null) {
      grpcServer.shutdown();
    }

    lifecycle.cancel(null);
    tasks.close();
    try {
      List<String> stragglers =
          tasks.awaitTermination(config.getShutdownTimeout().toNanos(), TimeUnit.NANOSECONDS);
      if (!stragglers.isEmpty()) {
        log.warn("background tasks still running after shutdown timeout, forcing",
            LogField.of("tasks", stragglers));
        if (grpcServer != null) {
          grpcServer.shutdownNow();
        }
        tasks.awaitTermination();
      }
    } catch (InterruptedException e) {
      log.warn("interrupted while waiting for background tasks",
          LogField.of("tasks", tasks.activeTaskNames()));
      if (grpcServer != null) {
        grpcServer.shutdownNow();
      }
      Thread.currentThread().interrupt();
    }
  }

  private void setState(State newState) {
    synchronized (lock) {
      state = newState;
      lock.notifyAll();
    }
  }

  public State state() {
    synchronized (lock) {
      return state;
    }
  }

  /** Bound gRPC address, or {@code null} before the listener is bound. */
  @Nullable
  public InetSocketAddress grpcAddress() {
    return grpcAddress;
  }

  /** Bound HTTP address, or {@code null} before the listener is bound. */
  @Nullable
  public InetSocketAddress httpAddress() {
    return httpAddress;
  }

  /** The gateway's base URL, e.g. {@code http://127.0.0.1:5555}. */
  public String httpListenAddr() {
    InetSocketAddress address = httpAddress;
    checkState(address != null, "http listener not bound");
    return "http://" + HostAndPort.fromParts(address.getHostString(), address.getPort());
  }

  /** Background tasks spawned by this server that have not finished. */
  public int activeTaskCount() {
    return tasks.activeCount();
  }

  /** Fully qualified names of the services served on the gRPC listener, health included. */
  public List<String> serviceNames() {
    Server server = grpcServer;
    if (server == null) {
      return ImmutableList.of();
    }
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (ServerServiceDefinition definition : server.getServices()) {
      names.add(definition.getServiceDescriptor().getName());
    }
    return names.build();
  }

  /** The chain installed on the gRPC listener, or {@code null} before start. */
  @Nullable
  public InterceptorChain interceptorChain() {
    return chain;
  }
}
