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

import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import java.util.logging.Logger;
import javax.annotation.Nullable;

/**
 * Leveled logging with key/value fields on top of {@link java.util.logging}.
 *
 * <p>Each line is rendered as {@code message key=value key=value}. The fields are also attached
 * to the {@link LogRecord} as its parameters, so handlers and formatters can consume them
 * without parsing the message. Debug maps to {@link Level#FINE}.
 */
public final class StructuredLogger {
  private final Logger logger;
  private final ImmutableList<LogField> boundFields;

  private StructuredLogger(Logger logger, ImmutableList<LogField> boundFields) {
    this.logger = checkNotNull(logger, "logger");
    this.boundFields = boundFields;
  }

  public static StructuredLogger of(String name) {
    return new StructuredLogger(Logger.getLogger(name), ImmutableList.<LogField>of());
  }

  public static StructuredLogger of(Class<?> clazz) {
    return of(clazz.getName());
  }

  /** Returns a logger for the child component {@code name}, keeping the bound fields. */
  public StructuredLogger named(String name) {
    return new StructuredLogger(Logger.getLogger(logger.getName() + "." + name), boundFields);
  }

  /** Returns a logger that adds {@code fields} to every line it writes. */
  public StructuredLogger with(LogField... fields) {
    return new StructuredLogger(
        logger,
        ImmutableList.<LogField>builder().addAll(boundFields).add(fields).build());
  }

  public String getName() {
    return logger.getName();
  }

  public Logger julLogger() {
    return logger;
  }

  public boolean isLoggable(Level level) {
    return logger.isLoggable(level);
  }

  public void debug(String msg, LogField... fields) {
    log(Level.FINE, msg, null, fields);
  }

  public void info(String msg, LogField... fields) {
    log(Level.INFO, msg, null, fields);
  }

  public void warn(String msg, LogField... fields) {
    log(Level.WARNING, msg, null, fields);
  }

  public void error(String msg, LogField... fields) {
    log(Level.SEVERE, msg, null, fields);
  }

  public void log(Level level, String msg, List<LogField> fields) {
    log(level, msg, null, fields.toArray(new LogField[0]));
  }

  /**
   * Writes one line. When a field carries a {@link Throwable} and {@code thrown} is null, that
   * throwable becomes the record's thrown value so its stack trace is kept.
   */
  public void log(Level level, String msg, @Nullable Throwable thrown, LogField... fields) {
    if (!logger.isLoggable(level)) {
      return;
    }
    LogField[] all = merge(fields);
    if (thrown == null) {
      for (LogField field : all) {
        if (field.value() instanceof Throwable) {
          thrown = (Throwable) field.value();
          break;
        }
      }
    }
    LogRecord record = new LogRecord(level, render(msg, all));
    record.setLoggerName(logger.getName());
    record.setParameters(all);
    record.setThrown(thrown);
    logger.log(record);
  }

  private LogField[] merge(LogField[] fields) {
    if (boundFields.isEmpty()) {
      return fields.clone();
    }
    LogField[] all = new LogField[boundFields.size() + fields.length];
    for (int i = 0; i < boundFields.size(); i++) {
      all[i] = boundFields.get(i);
    }
    System.arraycopy(fields, 0, all, boundFields.size(), fields.length);
    return all;
  }

  static String render(String msg, LogField[] fields) {
    StringBuilder sb = new StringBuilder(msg);
    for (LogField field : fields) {
      sb.append(' ').append(field.key()).append('=').append(field.renderedValue());
    }
    return sb.toString();
  }
}
