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

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.collect.ImmutableList;
import io.grpc.Metadata;
import io.grpc.MethodDescriptor.MethodType;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * An ordered, immutable list of named interceptor pairs, one for unary calls and one for streaming
 * calls. The first entry added is the outermost: it sees a call first and its outcome last.
 */
public final class InterceptorChain {

  /** One named stage of the chain. */
  public static final class Entry {
    private final String name;
    private final ServerInterceptor unary;
    private final ServerInterceptor stream;

    Entry(String name, ServerInterceptor unary, ServerInterceptor stream) {
      this.name = name;
      this.unary = unary;
      this.stream = stream;
    }

    public String getName() {
      return name;
    }

    public ServerInterceptor getUnary() {
      return unary;
    }

    public ServerInterceptor getStream() {
      return stream;
    }
  }

  private final ImmutableList<Entry> entries;

  private InterceptorChain(ImmutableList<Entry> entries) {
    this.entries = entries;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  public List<Entry> entries() {
    return entries;
  }

  public List<String> names() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    for (Entry entry : entries) {
      names.add(entry.name);
    }
    return names.build();
  }

  /** Unary interceptors, outermost first. */
  public List<ServerInterceptor> unaryInterceptors() {
    ImmutableList.Builder<ServerInterceptor> interceptors = ImmutableList.builder();
    for (Entry entry : entries) {
      interceptors.add(entry.unary);
    }
    return interceptors.build();
  }

  /** Stream interceptors, outermost first. */
  public List<ServerInterceptor> streamInterceptors() {
    ImmutableList.Builder<ServerInterceptor> interceptors = ImmutableList.builder();
    for (Entry entry : entries) {
      interceptors.add(entry.stream);
    }
    return interceptors.build();
  }

  /**
   * Returns a single interceptor that runs the unary list for unary methods and the stream list for
   * every other method type.
   */
  public ServerInterceptor asServerInterceptor() {
    return new ChainInterceptor(unaryInterceptors(), streamInterceptors());
  }

  private static final class ChainInterceptor implements ServerInterceptor {
    private final List<ServerInterceptor> unary;
    private final List<ServerInterceptor> stream;

    ChainInterceptor(List<ServerInterceptor> unary, List<ServerInterceptor> stream) {
      this.unary = unary;
      this.stream = stream;
    }

    @Override
    public <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
        ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
      List<ServerInterceptor> interceptors =
          call.getMethodDescriptor().getType() == MethodType.UNARY ? unary : stream;
      ServerCallHandler<ReqT, RespT> handler = next;
      for (int i = interceptors.size() - 1; i >= 0; i--) {
        handler = intercepted(interceptors.get(i), handler);
      }
      return handler.startCall(call, headers);
    }

    private static <ReqT, RespT> ServerCallHandler<ReqT, RespT> intercepted(
        final ServerInterceptor interceptor, final ServerCallHandler<ReqT, RespT> next) {
      return (call, headers) -> interceptor.interceptCall(call, headers, next);
    }
  }

  public static final class Builder {
    private final ImmutableList.Builder<Entry> entries = ImmutableList.builder();
    private final Set<String> names = new HashSet<>();

    private Builder() {}

    /** Appends a stage. Names must be unique within the chain. */
    public Builder add(String name, ServerInterceptor unary, ServerInterceptor stream) {
      checkNotNull(name, "name");
      checkArgument(names.add(name), "duplicate interceptor name: %s", name);
      entries.add(new Entry(name, checkNotNull(unary, "unary"), checkNotNull(stream, "stream")));
      return this;
    }

    public InterceptorChain build() {
      return new InterceptorChain(entries.build());
    }
  }
}
