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

package org.xmtp.node.metrics;

import java.util.List;
import org.xmtp.node.logging.LogField;

/**
 * Receives one event per completed API call. Implementations must not block the caller.
 */
public interface MetricsSink {
  MetricsSink NOOP = new MetricsSink() {
    @Override
    public void emitApiRequest(List<LogField> fields) {}
  };

  void emitApiRequest(List<LogField> fields);
}
