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

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.greaterThanOrEqualTo;
import static org.hamcrest.Matchers.instanceOf;
import static org.hamcrest.Matchers.lessThanOrEqualTo;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Runs the governor with real threads and the real scheduler.
 */
class SourceGovernorConcurrencyTest {
  private final ExecutorScheduler scheduler = new ExecutorScheduler(ExecutorScheduler.newExecutor("test-governor-%d"));
  private final ExecutorService workers = Executors.newFixedThreadPool(16);

  @AfterEach
  void tearDown() throws InterruptedException {
    workers.shutdownNow();
    assertTrue(workers.awaitTermination(5, TimeUnit.SECONDS), "Workers did not terminate");
    scheduler.close();
  }

  private SourceGovernor governor(Map<String, SourceConfig> sources, GovernorPolicy policy) {
    return new SourceGovernor(sources, policy, Clock.systemUTC(), scheduler);
  }

  private static void awaitQueued(SourceGovernor governor, String source, int waiters) throws InterruptedException {
    var deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
    while (governor.snapshot(source).orElseThrow().queuedWaiters() < waiters) {
      assertTrue(System.nanoTime() < deadline, "Callers never queued");
      Thread.sleep(5);
    }
  }

  @Test
  void inFlightNeverExceedsMaxConcurrent() throws InterruptedException {
    var config = new SourceConfig(10_000, Duration.ofSeconds(1), 3, Duration.ZERO);
    var governor = governor(Map.of("api", config), GovernorPolicy.defaults());

    var numThreads = 12;
    var callsPerThread = 20;
    var startLatch = new CountDownLatch(1);
    var doneLatch = new CountDownLatch(numThreads);
    var inFlight = new AtomicInteger();
    var peak = new AtomicInteger();

    for (var i = 0; i < numThreads; i++) {
      workers.submit(() -> {
        try {
          startLatch.await();
          for (var call = 0; call < callsPerThread; call++) {
            governor.acquire("api");
            var current = inFlight.incrementAndGet();
            peak.accumulateAndGet(current, Math::max);
            Thread.sleep(1);
            inFlight.decrementAndGet();
            governor.reportSuccess("api");
          }
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } finally {
          doneLatch.countDown();
        }
      });
    }

    startLatch.countDown();
    assertTrue(doneLatch.await(30, TimeUnit.SECONDS), "Test timed out");

    assertThat(peak.get(), lessThanOrEqualTo(3));
    var state = governor.snapshot("api").orElseThrow();
    assertEquals(0, state.inFlight());
    assertEquals(0, state.queuedWaiters());
  }

  @Test
  void burstRespectsTheSlidingWindow() throws InterruptedException {
    var config = new SourceConfig(5, Duration.ofMillis(200), 50, Duration.ZERO);
    var governor = governor(Map.of("api", config), GovernorPolicy.defaults());

    var numThreads = 15;
    var startLatch = new CountDownLatch(1);
    var doneLatch = new CountDownLatch(numThreads);
    List<Instant> admitted = Collections.synchronizedList(new ArrayList<>());

    for (var i = 0; i < numThreads; i++) {
      workers.submit(() -> {
        try {
          startLatch.await();
          governor.acquire("api");
          admitted.add(Instant.now());
          governor.reportSuccess("api");
        } catch (InterruptedException e) {
          Thread.currentThread().interrupt();
        } finally {
          doneLatch.countDown();
        }
      });
    }

    startLatch.countDown();
    assertTrue(doneLatch.await(10, TimeUnit.SECONDS), "Test timed out");

    var sorted = new ArrayList<>(admitted);
    Collections.sort(sorted);
    assertEquals(numThreads, sorted.size());
    // Waiting admissions also sit out the 100ms margin, which absorbs scheduling jitter here
    for (var i = 0; i + 5 < sorted.size(); i++) {
      assertThat(Duration.between(sorted.get(i), sorted.get(i + 5)), greaterThanOrEqualTo(Duration.ofMillis(200)));
    }
  }

  @Test
  void blockedCallersFailFastWhenTheBreakerTrips() throws Exception {
    var config = new SourceConfig(100, Duration.ofMinutes(1), 1, Duration.ZERO);
    var policy = new GovernorPolicy(1, Duration.ofSeconds(1), Duration.ofSeconds(60), 3, Duration.ofMillis(100),
        Set.of(429));
    var governor = governor(Map.of("api", config), policy);

    governor.acquire("api");
    var blocked = new ArrayList<Future<Throwable>>();
    for (var i = 0; i < 3; i++) {
      blocked.add(workers.submit(() -> {
        try {
          governor.acquire("api");
          return new AssertionError("admitted while the breaker should be open");
        } catch (SourceUnavailableException e) {
          return e;
        }
      }));
    }
    awaitQueued(governor, "api", 3);

    governor.reportFailure("api");

    for (var caller : blocked) {
      assertThat(caller.get(1, TimeUnit.SECONDS), instanceOf(SourceUnavailableException.class));
    }
    assertEquals(0, governor.snapshot("api").orElseThrow().inFlight());
  }

  @Test
  void contentionOnOneSourceDoesNotBlockAnother() throws Exception {
    var slow = new SourceConfig(100, Duration.ofMinutes(1), 1, Duration.ZERO);
    var fast = new SourceConfig(100, Duration.ofMinutes(1), 5, Duration.ZERO);
    var governor = governor(Map.of("slow", slow, "fast", fast), GovernorPolicy.defaults());

    governor.acquire("slow");
    var waiting = workers.submit(() -> governor.acquire("slow"));
    awaitQueued(governor, "slow", 1);

    var other = governor.acquireAsync("fast");
    assertTrue(other.isDone());
    governor.reportSuccess("fast");
    assertFalse(waiting.isDone());

    governor.reportSuccess("slow");
    waiting.get(1, TimeUnit.SECONDS);
    governor.reportSuccess("slow");
    assertEquals(0, governor.snapshot("slow").orElseThrow().inFlight());
  }
}
