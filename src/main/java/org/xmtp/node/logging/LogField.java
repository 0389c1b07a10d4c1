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

package org.xmtp.node.logging;

import static com.google.common.base.Preconditions.checkNotNull;

import com.google.common.base.MoreObjects;
import java.util.Objects;
import javax.annotation.Nullable;

/**
 * A single key/value pair attached to a structured log line or a metrics event.
 */
public final class LogField {
  public static final String ERROR_KEY = "error";

  private final String key;
  @Nullable
  private final Object value;

  private LogField(String key, @Nullable Object value) {
    this.key = checkNotNull(key, "key");
    this.value = value;
  }

  public static LogField of(String key, @Nullable Object value) {
    return new LogField(key, value);
  }

  public static LogField string(String key, @Nullable String value) {
    return new LogField(key, value);
  }

  public static LogField error(Throwable t) {
    return new LogField(ERROR_KEY, checkNotNull(t, "t"));
  }

  public String key() {
    return key;
  }

  @Nullable
  public Object value() {
    return value;
  }

  /**
   * Returns the value as it appears in a rendered log line. Throwables render as their message,
   * or their class name when they carry none.
   */
  public String renderedValue() {
    if (value instanceof Throwable) {
      Throwable t = (Throwable) value;
      return t.getMessage() != null ? t.getMessage() : t.getClass().getName();
    }
    return String.valueOf(value);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof LogField)) {
      return false;
    }
    LogField that = (LogField) o;
    return key.equals(that.key) && Objects.equals(value, that.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(key, value);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this).add("key", key).add("value", value).toString();
  }
}
