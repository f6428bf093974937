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

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableMap;
import com.google.common.util.concurrent.Uninterruptibles;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.InstantSource;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.Function;
import java.util.function.Supplier;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

/**
 * Admission control for a fixed set of named, unreliable remote sources.
 * <p>
 * Each configured source gets its own concurrency limit, sliding-window quota,
 * minimum spacing between requests, exponential backoff after failures, and a
 * breaker that fails every admission fast once too many calls in a row have
 * failed. The breaker closes again on the next reported success.
 * </p>
 * <p>
 * Every successful {@link #acquire} hands the caller one concurrency slot, and
 * the caller must give it back by calling {@link #reportSuccess} or
 * {@link #reportFailure} exactly once. A missing report leaks the slot for the
 * life of the governor. The {@code attempt} and {@code wrap} helpers do the
 * reporting for you.
 * </p>
 * <p>
 * Sources that are not in the table are not throttled at all: acquiring them
 * returns immediately and reports on them are ignored.
 * </p>
 */
public class SourceGovernor {
  private static final Logger LOG = LoggerFactory.getLogger(SourceGovernor.class);

  private final ImmutableMap<String, SourceConfig> sources;
  private final GovernorPolicy policy;
  private final InstantSource clock;
  private final Scheduler scheduler;
  private final ConcurrentHashMap<String, SourceState> states = new ConcurrentHashMap<>();

  /**
   * A fully configurable governor.
   *
   * @param sources
   *          the budget of each source to be throttled
   * @param policy
   *          backoff and breaker constants shared by all sources
   * @param clock
   *          the time source for windows, spacing and backoff (mainly for
   *          testing)
   * @param scheduler
   *          runs the resumption of each timed wait (mainly for testing)
   */
  public SourceGovernor(Map<String, SourceConfig> sources, GovernorPolicy policy, InstantSource clock,
      Scheduler scheduler) {
    this.sources = ImmutableMap.copyOf(sources);
    this.policy = policy;
    this.clock = clock;
    this.scheduler = scheduler;
  }

  /**
   * A governor for the given sources with the default policy, using the system
   * clock and the shared scheduler thread.
   */
  public SourceGovernor(Map<String, SourceConfig> sources) {
    this(sources, GovernorPolicy.defaults(), Clock.systemUTC(), ExecutorScheduler.shared());
  }

  /**
   * A governor for {@link SourceTables#defaults()}.
   */
  public SourceGovernor() {
    this(SourceTables.defaults());
  }

  /**
   * Wait until a request against {@code source} may be issued.
   * <p>
   * The wait cannot be interrupted; if the thread is interrupted while waiting,
   * the interrupt is restored once admission is decided.
   * </p>
   *
   * @throws SourceUnavailableException
   *           if the source's breaker is open, either on entry or after waiting
   *           for a concurrency slot
   */
  public void acquire(String source) {
    try {
      Uninterruptibles.getUninterruptibly(acquireAsync(source));
    } catch (ExecutionException e) {
      var cause = e.getCause();
      Throwables.throwIfUnchecked(cause);
      throw new IllegalStateException("Admission to " + source + " failed", cause);
    }
  }

  /**
   * Asynchronous form of {@link #acquire}.
   * <p>
   * The future completes once the call is admitted, or exceptionally with
   * {@link SourceUnavailableException}. When the breaker is already open the
   * returned future has already failed. Cancelling the future does not withdraw
   * the request.
   * </p>
   */
  public CompletableFuture<Void> acquireAsync(String source) {
    var state = stateFor(source);
    if (state == null) {
      LOG.debug("{} is not a governed source, admitting immediately", source);
      return CompletableFuture.completedFuture(null);
    }

    var admission = new CompletableFuture<Void>();
    state.lock.lock();
    try {
      if (state.unavailable) {
        admission.completeExceptionally(unavailable(state));
        return admission;
      }
      if (state.inFlight >= state.config.maxConcurrent()) {
        state.waiters.addLast(admission);
        return admission;
      }
      state.inFlight++;
    } finally {
      state.lock.unlock();
    }
    proceed(state, admission);
    return admission;
  }

  /**
   * Report that an admitted call succeeded. Resets the failure count, closes the
   * breaker if it was open, and frees the caller's slot.
   */
  public void reportSuccess(String source) {
    var state = stateFor(source);
    if (state == null) {
      return;
    }

    var afterUnlock = new ArrayList<Runnable>();
    state.lock.lock();
    try {
      state.consecutiveFailures = 0;
      if (state.unavailable) {
        state.unavailable = false;
        LOG.info("{} succeeded again, re-enabling requests", source);
      }
      releaseSlot(state, afterUnlock);
    } finally {
      state.lock.unlock();
    }
    afterUnlock.forEach(Runnable::run);
  }

  /**
   * Report that an admitted call failed for a reason other than explicit
   * throttling.
   */
  public void reportFailure(String source) {
    reportFailure(source, null);
  }

  /**
   * Report that an admitted call failed, with the status code the remote service
   * returned. A throttling status (429 by default) lengthens the backoff.
   */
  public void reportFailure(String source, int statusCode) {
    reportFailure(source, Integer.valueOf(statusCode));
  }

  private void reportFailure(String source, @Nullable Integer statusCode) {
    var state = stateFor(source);
    if (state == null) {
      return;
    }

    var afterUnlock = new ArrayList<Runnable>();
    state.lock.lock();
    try {
      // With the breaker already open the call either started before it opened or
      // never reached the remote, so it only gives its slot back
      if (!state.unavailable) {
        recordFailure(state, statusCode, afterUnlock);
      }
      releaseSlot(state, afterUnlock);
    } finally {
      state.lock.unlock();
    }
    afterUnlock.forEach(Runnable::run);
  }

  private void recordFailure(SourceState state, @Nullable Integer statusCode, List<Runnable> afterUnlock) {
    var failures = ++state.consecutiveFailures;
    var delay = policy.backoffDelay(failures, statusCode);
    state.backoffUntil = clock.instant().plus(delay);
    LOG.warn("{} failure #{} (status {}), backing off for {}ms", state.name, failures, statusCode, delay.toMillis());

    if (failures >= policy.failureThreshold()) {
      state.unavailable = true;
      var drained = state.wakeAll();
      LOG.error("{} appears unavailable after {} consecutive failures, disabling requests ({} waiting callers released)",
          state.name, failures, drained.size());
      for (var waiter : drained) {
        var rejection = unavailable(state);
        afterUnlock.add(() -> waiter.completeExceptionally(rejection));
      }
    }
  }

  /**
   * Whether the breaker for {@code source} is open. This is a cheap, advisory
   * check for callers that would rather skip work than handle
   * {@link SourceUnavailableException}; the answer may be stale by the time it
   * is acted on.
   */
  public boolean isUnavailable(String source) {
    var state = states.get(checkSource(source));
    return state != null && state.unavailable;
  }

  /**
   * A copy of the current state of {@code source}, or empty if it is not
   * governed.
   */
  public Optional<SourceSnapshot> snapshot(String source) {
    if (!sources.containsKey(checkSource(source))) {
      return Optional.empty();
    }
    var state = states.get(source);
    if (state == null) {
      // Not used yet; peeking must not create state
      return Optional.of(new SourceSnapshot(source, 0, 0, 0, 0, null, false));
    }
    state.lock.lock();
    try {
      return Optional.of(state.snapshot(clock.instant()));
    } finally {
      state.lock.unlock();
    }
  }

  /**
   * Acquire, call the callable, and report the outcome. Exceptions implementing
   * {@link StatusCodeCarrier} report their status code.
   *
   * @throws SourceUnavailableException
   *           if the source's breaker is open; the callable is not called
   */
  public <T> T checkedAttempt(String source, Callable<T> callable) throws Exception {
    acquire(source);
    T result;
    @Nullable Integer statusCode = null;
    var success = false;
    try {
      result = callable.call();
      success = true;
      return result;
    } catch (Exception e) {
      if (e instanceof StatusCodeCarrier carrier) {
        statusCode = carrier.statusCode();
      }
      throw e;
    } finally {
      if (success) {
        reportSuccess(source);
      } else {
        reportFailure(source, statusCode);
      }
    }
  }

  /**
   * Acquire, call the supplier, and report the outcome.
   *
   * @throws SourceUnavailableException
   *           if the source's breaker is open, or any exception thrown by the
   *           supplier
   */
  public <T> T attempt(String source, Supplier<T> supplier) {
    try {
      return checkedAttempt(source, supplier::get);
    } catch (Exception e) {
      Throwables.throwIfUnchecked(e);
      throw new IllegalStateException(e);
    }
  }

  /**
   * Acquire, run the runnable, and report the outcome.
   *
   * @throws SourceUnavailableException
   *           if the source's breaker is open, or any exception thrown by the
   *           runnable
   */
  public void attempt(String source, Runnable runnable) {
    attempt(source, () -> {
      runnable.run();
      return Boolean.TRUE;
    });
  }

  /**
   * Like {@link #attempt(String, Supplier)}, but returns {@code fallback}
   * without calling the supplier when the source's breaker is open.
   */
  public <T> T attemptOrElse(String source, Supplier<T> supplier, T fallback) {
    if (isUnavailable(source)) {
      LOG.debug("{} is unavailable, using fallback", source);
      return fallback;
    }
    try {
      return attempt(source, supplier);
    } catch (SourceUnavailableException e) {
      if (!e.source.equals(source)) {
        throw e;
      }
      LOG.debug("{} became unavailable, using fallback", source);
      return fallback;
    }
  }

  /**
   * Wrap a Supplier so that each call is admitted and reported against
   * {@code source}.
   */
  public <T> Supplier<T> wrap(String source, Supplier<T> supplier) {
    checkSource(source);
    return () -> attempt(source, supplier);
  }

  /**
   * Wrap a Function so that each call is admitted and reported against
   * {@code source}.
   */
  public <T, R> Function<T, R> wrap(String source, Function<T, R> function) {
    checkSource(source);
    return (T t) -> attempt(source, () -> function.apply(t));
  }

  /**
   * Runs the timed steps for an admission that holds a slot. Each wait is one
   * scheduled resumption, after which all the timed checks run again.
   */
  private void proceed(SourceState state, CompletableFuture<Void> admission) {
    Duration wait;
    state.lock.lock();
    try {
      var now = clock.instant();
      wait = state.admissionDelay(now, policy.windowMargin());
      if (wait.isZero()) {
        state.recordAdmission(now);
      } else if (state.backoffUntil != null && state.backoffUntil.isAfter(now)) {
        LOG.warn("Backing off {} for {}ms", state.name, wait.toMillis());
      } else {
        LOG.debug("Waiting {}ms for {}", wait.toMillis(), state.name);
      }
    } finally {
      state.lock.unlock();
    }

    if (wait.isZero()) {
      admission.complete(null);
      return;
    }
    try {
      scheduler.schedule(() -> proceed(state, admission), wait);
    } catch (RejectedExecutionException e) {
      LOG.error("Could not schedule admission for {}, releasing its slot", state.name, e);
      var afterUnlock = new ArrayList<Runnable>();
      state.lock.lock();
      try {
        releaseSlot(state, afterUnlock);
      } finally {
        state.lock.unlock();
      }
      afterUnlock.forEach(Runnable::run);
      admission.completeExceptionally(e);
    }
  }

  /**
   * Frees one slot. If anyone is waiting, the head of the queue either inherits
   * the slot or, with the breaker open, is rejected. Must hold the lock; the
   * resulting work is added to {@code afterUnlock}.
   */
  private void releaseSlot(SourceState state, List<Runnable> afterUnlock) {
    var next = state.wakeOne();
    if (next != null && !state.unavailable) {
      afterUnlock.add(() -> proceed(state, next));
      return;
    }
    state.inFlight = Math.max(0, state.inFlight - 1);
    if (next != null) {
      var rejection = unavailable(state);
      afterUnlock.add(() -> next.completeExceptionally(rejection));
    }
  }

  private static SourceUnavailableException unavailable(SourceState state) {
    return new SourceUnavailableException(state.name, state.consecutiveFailures);
  }

  @VisibleForTesting
  int trackedSources() {
    return states.size();
  }

  private static String checkSource(String source) {
    checkNotNull(source, "source");
    checkArgument(!source.isBlank(), "source must not be blank");
    return source;
  }

  private @Nullable SourceState stateFor(String source) {
    var config = sources.get(checkSource(source));
    if (config == null) {
      return null;
    }
    return states.computeIfAbsent(source, name -> new SourceState(name, config));
  }
}
