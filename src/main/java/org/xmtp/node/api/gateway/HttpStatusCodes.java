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

import io.grpc.Status;
import io.netty.handler.codec.http.HttpResponseStatus;

/** Maps gRPC status codes to the HTTP statuses the gateway answers with. */
final class HttpStatusCodes {
  private HttpStatusCodes() {}

  static HttpResponseStatus fromGrpcCode(Status.Code code) {
    switch (code) {
      case OK:
        return HttpResponseStatus.OK;
      case CANCELLED:
        // nginx's "client closed request"
        return HttpResponseStatus.valueOf(499, "Client Closed Request");
      case UNKNOWN:
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
      case INVALID_ARGUMENT:
        return HttpResponseStatus.BAD_REQUEST;
      case DEADLINE_EXCEEDED:
        return HttpResponseStatus.GATEWAY_TIMEOUT;
      case NOT_FOUND:
        return HttpResponseStatus.NOT_FOUND;
      case ALREADY_EXISTS:
        return HttpResponseStatus.CONFLICT;
      case PERMISSION_DENIED:
        return HttpResponseStatus.FORBIDDEN;
      case UNAUTHENTICATED:
        return HttpResponseStatus.UNAUTHORIZED;
      case RESOURCE_EXHAUSTED:
        return HttpResponseStatus.TOO_MANY_REQUESTS;
      case FAILED_PRECONDITION:
        return HttpResponseStatus.BAD_REQUEST;
      case ABORTED:
        return HttpResponseStatus.CONFLICT;
      case OUT_OF_RANGE:
        return HttpResponseStatus.BAD_REQUEST;
      case UNIMPLEMENTED:
        return HttpResponseStatus.NOT_IMPLEMENTED;
      case INTERNAL:
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
      case UNAVAILABLE:
        return HttpResponseStatus.SERVICE_UNAVAILABLE;
      case DATA_LOSS:
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
      default:
        return HttpResponseStatus.INTERNAL_SERVER_ERROR;
    }
  }
}
