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

import com.google.common.io.BaseEncoding;
import com.google.protobuf.ByteString;
import com.google.protobuf.Descriptors.Descriptor;
import com.google.protobuf.Descriptors.EnumValueDescriptor;
import com.google.protobuf.Descriptors.FieldDescriptor;
import com.google.protobuf.InvalidProtocolBufferException;
import com.google.protobuf.Message;
import com.google.protobuf.util.JsonFormat;
import io.grpc.Status;
import io.grpc.StatusException;
import java.util.List;
import java.util.Map;
import javax.annotation.Nullable;

/**
 * Builds a request message from an HTTP request: first the body, then path variables, then query
 * parameters. Path and query values bind to top-level scalar, enum and bytes fields, repeated or
 * not. Unknown query parameters and unknown JSON fields are ignored.
 */
final class RequestBinder {
  private static final JsonFormat.Parser PARSER = JsonFormat.parser().ignoringUnknownFields();

  private RequestBinder() {}

  /**
   * Returns the request for {@code route}.
   *
   * @throws StatusException with {@code INVALID_ARGUMENT} when the body or a parameter cannot be
   *     bound
   */
  static Message bind(GatewayRoute route, Map<String, String> pathVariables,
      Map<String, List<String>> queryParameters, String body) throws StatusException {
    Message.Builder builder = route.requestPrototype().newBuilderForType();
    Descriptor descriptor = builder.getDescriptorForType();
    String bodyField = route.body();
    if (!bodyField.isEmpty() && !body.trim().isEmpty()) {
      try {
        if (bodyField.equals(GatewayRoute.WHOLE_BODY)) {
          PARSER.merge(body, builder);
        } else {
          FieldDescriptor field = findField(descriptor, bodyField);
          // Wrapping lets the JSON parser handle message, repeated and scalar body fields alike.
          PARSER.merge("{\"" + field.getJsonName() + "\":" + body + "}", builder);
        }
      } catch (InvalidProtocolBufferException | RuntimeException e) {
        throw invalidArgument("invalid request body: " + e.getMessage(), e);
      }
    }
    for (Map.Entry<String, String> variable : pathVariables.entrySet()) {
      FieldDescriptor field = findField(descriptor, variable.getKey());
      if (field == null) {
        throw invalidArgument("unknown path field " + variable.getKey(), null);
      }
      setValue(builder, field, variable.getValue());
    }
    if (bodyField.equals(GatewayRoute.WHOLE_BODY)) {
      return builder.build();
    }
    for (Map.Entry<String, List<String>> parameter : queryParameters.entrySet()) {
      String name = parameter.getKey();
      FieldDescriptor field = findField(descriptor, name);
      if (field == null || pathVariables.containsKey(name) || name.equals(bodyField)) {
        continue;
      }
      if (field.isRepeated()) {
        builder.clearField(field);
        for (String value : parameter.getValue()) {
          setValue(builder, field, value);
        }
      } else if (!parameter.getValue().isEmpty()) {
        List<String> values = parameter.getValue();
        setValue(builder, field, values.get(values.size() - 1));
      }
    }
    return builder.build();
  }

  /** Looks a top-level field up by its proto name, then by its JSON name. */
  @Nullable
  static FieldDescriptor findField(Descriptor descriptor, String name) {
    FieldDescriptor field = descriptor.findFieldByName(name);
    if (field != null) {
      return field;
    }
    for (FieldDescriptor candidate : descriptor.getFields()) {
      if (candidate.getJsonName().equals(name)) {
        return candidate;
      }
    }
    return null;
  }

  private static void setValue(Message.Builder builder, FieldDescriptor field, String value)
      throws StatusException {
    Object converted;
    try {
      converted = convert(field, value);
    } catch (IllegalArgumentException e) {
      throw invalidArgument(
          "invalid value for field " + field.getName() + ": " + e.getMessage(), e);
    }
    if (field.isRepeated()) {
      builder.addRepeatedField(field, converted);
    } else {
      builder.setField(field, converted);
    }
  }

  private static Object convert(FieldDescriptor field, String value) {
    switch (field.getType()) {
      case STRING:
        return value;
      case BOOL:
        if (value.equals("true")) {
          return true;
        } else if (value.equals("false")) {
          return false;
        }
        throw new IllegalArgumentException("not a bool: " + value);
      case INT32:
      case SINT32:
      case SFIXED32:
        return Integer.parseInt(value);
      case UINT32:
      case FIXED32:
        return Integer.parseUnsignedInt(value);
      case INT64:
      case SINT64:
      case SFIXED64:
        return Long.parseLong(value);
      case UINT64:
      case FIXED64:
        return Long.parseUnsignedLong(value);
      case FLOAT:
        return Float.parseFloat(value);
      case DOUBLE:
        return Double.parseDouble(value);
      case BYTES:
        return ByteString.copyFrom(decodeBase64(value));
      case ENUM:
        EnumValueDescriptor enumValue = field.getEnumType().findValueByName(value);
        if (enumValue == null) {
          enumValue = field.getEnumType().findValueByNumber(Integer.parseInt(value));
        }
        if (enumValue == null) {
          throw new IllegalArgumentException("unknown enum value " + value);
        }
        return enumValue;
      default:
        throw new IllegalArgumentException(
            "fields of type " + field.getType() + " cannot be bound from a path or query");
    }
  }

  private static byte[] decodeBase64(String value) {
    String trimmed = value.replace("=", "");
    if (trimmed.indexOf('-') >= 0 || trimmed.indexOf('_') >= 0) {
      return BaseEncoding.base64Url().omitPadding().decode(trimmed);
    }
    return BaseEncoding.base64().omitPadding().decode(trimmed);
  }

  private static StatusException invalidArgument(String message, @Nullable Throwable cause) {
    return Status.INVALID_ARGUMENT.withDescription(message).withCause(cause).asException();
  }
}
