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

import static com.google.common.truth.Truth.assertThat;

import java.io.IOException;
import java.util.Arrays;
import java.util.logging.Level;
import java.util.logging.LogRecord;
import org.junit.Rule;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.JUnit4;

/** Unit tests for {@link StructuredLogger}. */
@RunWith(JUnit4.class)
public class StructuredLoggerTest {
  private static final String LOGGER_NAME = "org.xmtp.node.logging.test";

  @Rule
  public final LogCapture logs = new LogCapture(LOGGER_NAME);

  private final StructuredLogger log = StructuredLogger.of(LOGGER_NAME);

  @Test
  public void rendersFieldsIntoMessage() {
    log.info("serving grpc", LogField.string("address", "127.0.0.1:5556"), LogField.of("n", 3));

    LogRecord record = logs.records().get(0);
    assertThat(record.getLevel()).isEqualTo(Level.INFO);
    assertThat(record.getMessage()).isEqualTo("serving grpc address=127.0.0.1:5556 n=3");
    assertThat(LogCapture.fields(record)).containsExactly(
        LogField.string("address", "127.0.0.1:5556"), LogField.of("n", 3)).inOrder();
  }

  @Test
  public void levels() {
    log.debug("d");
    log.info("i");
    log.warn("w");
    log.error("e");

    assertThat(Arrays.asList(
        logs.records().get(0).getLevel(),
        logs.records().get(1).getLevel(),
        logs.records().get(2).getLevel(),
        logs.records().get(3).getLevel()))
        .containsExactly(Level.FINE, Level.INFO, Level.WARNING, Level.SEVERE).inOrder();
  }

  @Test
  public void errorFieldBecomesThrown() {
    IOException failure = new IOException("disk gone");
    log.error("closing service", LogField.error(failure));

    LogRecord record = logs.records().get(0);
    assertThat(record.getThrown()).isSameInstanceAs(failure);
    assertThat(record.getMessage()).isEqualTo("closing service error=disk gone");
  }

  @Test
  public void errorWithoutMessageRendersClassName() {
    log.warn("oops", LogField.error(new IllegalStateException()));

    assertThat(logs.records().get(0).getMessage())
        .isEqualTo("oops error=java.lang.IllegalStateException");
  }

  @Test
  public void boundFieldsComeFirst() {
    StructuredLogger bound = log.with(LogField.string("component", "gateway"));
    bound.info("bound", LogField.string("path", "/"));

    assertThat(logs.records().get(0).getMessage()).isEqualTo("bound component=gateway path=/");
  }

  @Test
  public void namedLoggerIsChild() {
    StructuredLogger child = log.named("authn");
    child.info("child line");

    assertThat(child.getName()).isEqualTo(LOGGER_NAME + ".authn");
    assertThat(logs.records()).hasSize(1);
    assertThat(logs.records().get(0).getLoggerName()).isEqualTo(LOGGER_NAME + ".authn");
  }

  @Test
  public void disabledLevelIsSkipped() {
    log.julLogger().setLevel(Level.INFO);

    log.debug("hidden");

    assertThat(logs.records()).isEmpty();
  }
}
