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

import io.grpc.ServerInterceptor;

/**
 * Admits or rejects calls before they reach a business handler. Rejected calls are closed with
 * {@code PERMISSION_DENIED} or {@code RESOURCE_EXHAUSTED}.
 */
public interface Authorizer {
  ServerInterceptor unary();

  ServerInterceptor stream();

  interface Factory {
    Authorizer create(AuthnConfig config);
  }
}
