/*
 * Copyright 2025 Andrew Aylett
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package eu.aylett.governor;

import com.google.common.util.concurrent.ThreadFactoryBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

/**
 * A {@link Scheduler} backed by a {@link ScheduledExecutorService}.
 * <p>
 * Tasks run on the executor's threads, so admission futures complete there. Keep
 * work done in their callbacks short, or hand it to another executor.
 * </p>
 */
public final class ExecutorScheduler implements Scheduler, AutoCloseable {
  private static final Logger LOG = LoggerFactory.getLogger(ExecutorScheduler.class);

  private static final class Shared {
    static final ExecutorScheduler INSTANCE = new ExecutorScheduler(newExecutor("source-governor-%d"));
  }

  private final ScheduledExecutorService executor;

  /**
   * Wraps an executor. Closing this scheduler shuts the executor down.
   */
  public ExecutorScheduler(ScheduledExecutorService executor) {
    this.executor = executor;
  }

  /**
   * A process-wide scheduler on a single daemon thread, used by governors that
   * are not given their own.
   */
  public static ExecutorScheduler shared() {
    return Shared.INSTANCE;
  }

  static ScheduledExecutorService newExecutor(String nameFormat) {
    var threadFactory = new ThreadFactoryBuilder().setNameFormat(nameFormat)
        .setDaemon(true)
        .build();
    var executor = new ScheduledThreadPoolExecutor(1, threadFactory);
    executor.setRemoveOnCancelPolicy(true);
    return executor;
  }

  @Override
  public void schedule(Runnable task, Duration delay) {
    // The executor keeps a task's exception inside a future nobody reads, so log it here
    Runnable logged = () -> {
      try {
        task.run();
      } catch (RuntimeException | Error e) {
        LOG.error("Scheduled governor task failed", e);
        throw e;
      }
    };
    executor.schedule(logged, Math.max(0, delay.toNanos()), TimeUnit.NANOSECONDS);
  }

  @Override
  public void close() {
    executor.shutdown();
  }
}
