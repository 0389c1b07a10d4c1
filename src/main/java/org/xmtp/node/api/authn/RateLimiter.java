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

package org.xmtp.node.api.authn;

import io.grpc.Context;
import java.time.Duration;
import org.xmtp.node.logging.StructuredLogger;

/**
 * Per-caller request quotas. How quotas are computed is up to the implementation; the server only
 * hands it to the {@link Authorizer} and runs its maintenance loop.
 */
public interface RateLimiter {

  /**
   * Sweeps quota entries idle for longer than {@code expiry}, every {@code sweepInterval}, until the
   * limiter's lifecycle context is cancelled.
   *
   * @throws InterruptedException if the sweeping thread is interrupted
   */
  void janitor(Duration sweepInterval, Duration expiry) throws InterruptedException;

  interface Factory {
    /**
     * Creates a limiter bound to {@code lifecycle}. Cancelling that context must make
     * {@link #janitor} return.
     */
    RateLimiter create(Context lifecycle, StructuredLogger log);
  }
}
