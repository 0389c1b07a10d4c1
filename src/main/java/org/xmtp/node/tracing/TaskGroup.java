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

package org.xmtp.node.tracing;

import static com.google.common.base.Preconditions.checkNotNull;
import static com.google.common.base.Preconditions.checkState;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;
import com.google.common.util.concurrent.ThreadFactoryBuilder;
import com.google.errorprone.annotations.concurrent.GuardedBy;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import io.opentelemetry.context.Context;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicReference;
import java.util.logging.Level;
import org.xmtp.node.logging.LogField;
import org.xmtp.node.logging.StructuredLogger;

/**
 * Spawns long-lived background tasks and joins them on shutdown.
 *
 * <p>Every task runs on its own thread inside {@link Tracing#run}, which tags the task's span when
 * the task fails. Around that sits a second recovery block owned by this class: a failed task is
 * logged with its stack trace and trace ids and goes no further, so one broken loop cannot take
 * down its siblings.
 *
 * <p>Once {@link #close} is called no further task can be spawned; tasks that are already running
 * are left alone and can be awaited with {@link #awaitTermination}.
 */
public final class TaskGroup {
  private final TracingClient tracing;
  private final Context rootContext;
  private final StructuredLogger log;
  private final ThreadFactory threadFactory;

  private final Object lock = new Object();
  @GuardedBy("lock")
  private final Set<Task> running = new LinkedHashSet<>();
  @GuardedBy("lock")
  private boolean closed;

  public TaskGroup(TracingClient tracing, Context rootContext, StructuredLogger log) {
    this(tracing, rootContext, log,
        new ThreadFactoryBuilder().setNameFormat("xmtp-task-%d").setDaemon(true).build());
  }

  @VisibleForTesting
  TaskGroup(TracingClient tracing, Context rootContext, StructuredLogger log,
      ThreadFactory threadFactory) {
    this.tracing = checkNotNull(tracing, "tracing");
    this.rootContext = checkNotNull(rootContext, "rootContext");
    this.log = checkNotNull(log, "log");
    this.threadFactory = checkNotNull(threadFactory, "threadFactory");
  }

  /**
   * Starts {@code action} on a new thread, in a span named {@code name}.
   *
   * @throws IllegalStateException if the group has been closed
   */
  public Task go(String name, TracedAction action) {
    checkNotNull(name, "name");
    checkNotNull(action, "action");
    Task task = new Task(name);
    synchronized (lock) {
      checkState(!closed, "task group is closed, cannot start %s", name);
      running.add(task);
    }
    Thread thread;
    try {
      thread = threadFactory.newThread(() -> runTask(task, action));
      thread.setName(thread.getName() + "-" + name);
      thread.start();
    } catch (RuntimeException | Error e) {
      finish(task);
      throw e;
    }
    return task;
  }

  private void runTask(Task task, TracedAction action) {
    AtomicReference<SpanContext> spanContext = new AtomicReference<>(SpanContext.getInvalid());
    try {
      Tracing.run(tracing, rootContext, task.name, ctx -> {
        spanContext.set(Span.fromContext(ctx).getSpanContext());
        action.run(ctx);
      });
    } catch (Throwable t) {
      List<LogField> fields = new ArrayList<>();
      fields.add(LogField.string("task", task.name));
      fields.add(LogField.error(t));
      for (LogField field : Tracing.traceFields(spanContext.get())) {
        fields.add(field);
      }
      log.log(Level.SEVERE, "background task failed", t, fields.toArray(new LogField[0]));
    } finally {
      finish(task);
    }
  }

  private void finish(Task task) {
    synchronized (lock) {
      running.remove(task);
    }
    task.done.set(null);
  }

  /** Stops accepting new tasks. Running tasks are not interrupted. */
  public void close() {
    synchronized (lock) {
      closed = true;
    }
  }

  public boolean isClosed() {
    synchronized (lock) {
      return closed;
    }
  }

  /** Number of tasks spawned by this group that have not yet finished. */
  public int activeCount() {
    synchronized (lock) {
      return running.size();
    }
  }

  /** Names of the tasks that have not yet finished, in spawn order. */
  public List<String> activeTaskNames() {
    ImmutableList.Builder<String> names = ImmutableList.builder();
    synchronized (lock) {
      for (Task task : running) {
        names.add(task.name);
      }
    }
    return names.build();
  }

  /**
   * Waits up to {@code timeout} for every running task to finish.
   *
   * @return the names of the tasks still running when the deadline passed, empty if all finished
   */
  public List<String> awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
    long deadline = System.nanoTime() + unit.toNanos(timeout);
    for (Task task : snapshot()) {
      long remaining = deadline - System.nanoTime();
      try {
        task.done.get(Math.max(0, remaining), TimeUnit.NANOSECONDS);
      } catch (TimeoutException e) {
        // Reported below through activeTaskNames().
        break;
      } catch (ExecutionException e) {
        throw new AssertionError("task future never fails", e);
      }
    }
    return activeTaskNames();
  }

  /** Waits for every running task to finish, however long that takes. */
  public void awaitTermination() throws InterruptedException {
    for (Task task : snapshot()) {
      try {
        task.done.get();
      } catch (ExecutionException e) {
        throw new AssertionError("task future never fails", e);
      }
    }
  }

  private List<Task> snapshot() {
    synchronized (lock) {
      return new ArrayList<>(running);
    }
  }

  /** Handle to a spawned task. */
  public static final class Task {
    private final String name;
    private final SettableFuture<Void> done = SettableFuture.create();

    private Task(String name) {
      this.name = name;
    }

    public String getName() {
      return name;
    }

    /** Completes when the task has returned or failed. Never fails itself. */
    public ListenableFuture<Void> whenDone() {
      return done;
    }

    @Override
    public String toString() {
      return "Task{" + name + (done.isDone() ? ", done}" : ", running}");
    }
  }
}
