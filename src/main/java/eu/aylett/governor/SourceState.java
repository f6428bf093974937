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

import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Mutable admission state for one source.
 * <p>
 * Everything except {@link #unavailable} must only be touched while holding
 * {@link #lock}. Instances never leave {@link SourceGovernor}.
 * </p>
 */
final class SourceState {
  final String name;
  final SourceConfig config;
  final ReentrantLock lock = new ReentrantLock();

  /** Admission times inside the trailing window, oldest first. */
  final ArrayDeque<Instant> requestTimestamps = new ArrayDeque<>();
  /** Callers waiting for a concurrency slot, in arrival order. */
  final ArrayDeque<CompletableFuture<Void>> waiters = new ArrayDeque<>();

  @Nullable Instant backoffUntil;
  @Nullable Instant lastRequestTime;
  int consecutiveFailures;
  int inFlight;
  // Written under the lock, read without it by isUnavailable
  volatile boolean unavailable;

  SourceState(String name, SourceConfig config) {
    this.name = name;
    this.config = config;
  }

  /**
   * How long an admission that already holds a slot must still wait: first any
   * backoff, then the minimum spacing, then room in the sliding window. Zero
   * means it may be recorded now.
   */
  Duration admissionDelay(Instant now, Duration windowMargin) {
    var backoff = backoffUntil;
    if (backoff != null && backoff.isAfter(now)) {
      return Duration.between(now, backoff);
    }

    var last = lastRequestTime;
    if (config.hasMinInterRequestDelay() && last != null) {
      var earliest = last.plus(config.minInterRequestDelay());
      if (earliest.isAfter(now)) {
        return Duration.between(now, earliest);
      }
    }

    prune(now);
    if (requestTimestamps.size() >= config.maxRequestsPerWindow()) {
      var oldest = requestTimestamps.getFirst();
      return Duration.between(now, oldest.plus(config.windowDuration())).plus(windowMargin);
    }
    return Duration.ZERO;
  }

  void recordAdmission(Instant now) {
    requestTimestamps.addLast(now);
    lastRequestTime = now;
  }

  void prune(Instant now) {
    var cutoff = now.minus(config.windowDuration());
    while (!requestTimestamps.isEmpty() && !requestTimestamps.getFirst().isAfter(cutoff)) {
      requestTimestamps.removeFirst();
    }
  }

  /**
   * Removes and returns the longest-waiting caller, if any.
   */
  @Nullable
  CompletableFuture<Void> wakeOne() {
    return waiters.pollFirst();
  }

  /**
   * Removes and returns every waiting caller, oldest first.
   */
  List<CompletableFuture<Void>> wakeAll() {
    var all = new ArrayList<>(waiters);
    waiters.clear();
    return all;
  }

  SourceSnapshot snapshot(Instant now) {
    prune(now);
    var backoff = backoffUntil;
    if (backoff != null && !backoff.isAfter(now)) {
      backoff = null;
    }
    return new SourceSnapshot(name, inFlight, waiters.size(), requestTimestamps.size(), consecutiveFailures, backoff,
        unavailable);
  }
}
