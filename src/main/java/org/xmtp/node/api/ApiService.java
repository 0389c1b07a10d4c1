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

import io.grpc.BindableService;
import java.io.Closeable;
import java.io.IOException;
import org.xmtp.node.logging.StructuredLogger;

/**
 * A business service served by the {@link ApiServer}. The server closes it before it stops
 * accepting connections, so in-flight handlers can wind down while their resources still exist.
 */
public interface ApiService extends BindableService, Closeable {

  /** Creates a service. Implementations capture their own store and other dependencies. */
  interface Factory {
    ApiService create(StructuredLogger log) throws IOException;
  }
}
