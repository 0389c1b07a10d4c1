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

import io.grpc.ForwardingServerCall.SimpleForwardingServerCall;
import io.grpc.ForwardingServerCallListener.SimpleForwardingServerCallListener;
import io.grpc.Metadata;
import io.grpc.ServerCall;
import io.grpc.ServerCallHandler;
import io.grpc.ServerInterceptor;
import io.grpc.Status;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Base for interceptors that observe how each call ends.
 *
 * <p>{@link OutcomeListener#onOutcome} fires exactly once per call, with the first of: the status
 * the call is closed with, {@link Status#CANCELLED} when the client goes away, or the status
 * derived from an exception thrown by the rest of the chain. The close status is reported before
 * it is passed on, so the outcome is observed before the client can see it.
 */
abstract class CallOutcomeInterceptor implements ServerInterceptor {

  interface OutcomeListener {
    void onOutcome(Status status);
  }

  /** Invoked on call start. The returned listener receives the call's single outcome. */
  abstract <ReqT, RespT> OutcomeListener callStarted(ServerCall<ReqT, RespT> call, Metadata headers);

  @Override
  public final <ReqT, RespT> ServerCall.Listener<ReqT> interceptCall(
      ServerCall<ReqT, RespT> call, Metadata headers, ServerCallHandler<ReqT, RespT> next) {
    final Outcome outcome = new Outcome(callStarted(call, headers));
    ServerCall<ReqT, RespT> observedCall = new SimpleForwardingServerCall<ReqT, RespT>(call) {
      @Override
      public void close(Status status, Metadata trailers) {
        outcome.report(status);
        super.close(status, trailers);
      }
    };
    ServerCall.Listener<ReqT> delegate;
    try {
      delegate = next.startCall(observedCall, headers);
    } catch (RuntimeException | Error e) {
      outcome.report(Status.fromThrowable(e));
      throw e;
    }
    return new SimpleForwardingServerCallListener<ReqT>(delegate) {
      @Override
      public void onMessage(ReqT message) {
        try {
          super.onMessage(message);
        } catch (RuntimeException | Error e) {
          outcome.report(Status.fromThrowable(e));
          throw e;
        }
      }

      @Override
      public void onHalfClose() {
        try {
          super.onHalfClose();
        } catch (RuntimeException | Error e) {
          outcome.report(Status.fromThrowable(e));
          throw e;
        }
      }

      @Override
      public void onReady() {
        try {
          super.onReady();
        } catch (RuntimeException | Error e) {
          outcome.report(Status.fromThrowable(e));
          throw e;
        }
      }

      @Override
      public void onCancel() {
        try {
          outcome.report(Status.CANCELLED);
        } finally {
          super.onCancel();
        }
      }
    };
  }

  private static final class Outcome {
    private final OutcomeListener listener;
    private final AtomicBoolean reported = new AtomicBoolean();

    Outcome(OutcomeListener listener) {
      this.listener = listener;
    }

    void report(Status status) {
      if (reported.compareAndSet(false, true)) {
        listener.onOutcome(status);
      }
    }
  }
}
