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

import com.google.common.base.Splitter;
import com.google.common.collect.ImmutableSet;
import org.jetbrains.annotations.Contract;
import org.jspecify.annotations.Nullable;

import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.Properties;
import java.util.Set;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Governor-wide failure handling constants.
 *
 * @param failureThreshold
 *          consecutive failures after which a source's breaker opens
 * @param baseDelay
 *          backoff after the first failure; doubles with each further failure
 * @param maxDelay
 *          cap on the doubled backoff, applied before the throttling multiplier
 * @param throttleMultiplier
 *          factor applied to the backoff when the remote service explicitly
 *          throttled us
 * @param windowMargin
 *          extra wait added when waiting for the oldest admission to leave the
 *          sliding window
 * @param throttlingStatusCodes
 *          status codes treated as explicit throttling
 */
public record GovernorPolicy(int failureThreshold, Duration baseDelay, Duration maxDelay, int throttleMultiplier,
    Duration windowMargin, Set<Integer> throttlingStatusCodes) {

  static final String PREFIX = "governor.";

  private static final GovernorPolicy DEFAULTS = new GovernorPolicy(5, Duration.ofSeconds(1), Duration.ofSeconds(60),
      3, Duration.ofMillis(100), Set.of(429));

  public GovernorPolicy {
    requireNonNull(baseDelay, "baseDelay");
    requireNonNull(maxDelay, "maxDelay");
    requireNonNull(windowMargin, "windowMargin");
    throttlingStatusCodes = ImmutableSet.copyOf(throttlingStatusCodes);
    checkArgument(failureThreshold > 0, "failureThreshold must be > 0, was %s", failureThreshold);
    checkArgument(!baseDelay.isNegative(), "baseDelay must be >= 0, was %s", baseDelay);
    checkArgument(maxDelay.compareTo(baseDelay) >= 0, "maxDelay %s must not be less than baseDelay %s", maxDelay,
        baseDelay);
    checkArgument(throttleMultiplier >= 1, "throttleMultiplier must be >= 1, was %s", throttleMultiplier);
    checkArgument(!windowMargin.isNegative(), "windowMargin must be >= 0, was %s", windowMargin);
  }

  /**
   * Five failures to trip, backoff from 1s doubling to 60s, tripled on HTTP 429,
   * and a 100ms window margin.
   */
  public static GovernorPolicy defaults() {
    return DEFAULTS;
  }

  /**
   * Reads {@code governor.*} keys, falling back to {@link #defaults()} for any
   * that are absent.
   *
   * @throws IllegalArgumentException
   *           if a present value cannot be parsed
   */
  public static GovernorPolicy fromProperties(Properties properties) {
    var threshold = intProperty(properties, PREFIX + "failure-threshold", DEFAULTS.failureThreshold);
    var base = durationProperty(properties, PREFIX + "base-delay", DEFAULTS.baseDelay);
    var max = durationProperty(properties, PREFIX + "max-delay", DEFAULTS.maxDelay);
    var multiplier = intProperty(properties, PREFIX + "throttle-multiplier", DEFAULTS.throttleMultiplier);
    var margin = durationProperty(properties, PREFIX + "window-margin", DEFAULTS.windowMargin);
    var codes = DEFAULTS.throttlingStatusCodes;
    var rawCodes = properties.getProperty(PREFIX + "throttling-status-codes");
    if (rawCodes != null) {
      var builder = ImmutableSet.<Integer>builder();
      for (var code : Splitter.on(',').trimResults().omitEmptyStrings().split(rawCodes)) {
        builder.add(parseInt(PREFIX + "throttling-status-codes", code));
      }
      codes = builder.build();
    }
    return new GovernorPolicy(threshold, base, max, multiplier, margin, codes);
  }

  /**
   * The backoff imposed after a failure: {@code baseDelay * 2^(failures - 1)},
   * capped at {@code maxDelay}, then multiplied by {@code throttleMultiplier} if
   * the status code is a throttling one.
   *
   * @param consecutiveFailures
   *          the failure count including the one being reported; at least one
   * @param statusCode
   *          the remote status code, if known
   */
  @Contract(pure = true)
  public Duration backoffDelay(int consecutiveFailures, @Nullable Integer statusCode) {
    checkArgument(consecutiveFailures > 0, "consecutiveFailures must be > 0, was %s", consecutiveFailures);
    // Anything past 2^62 is over any sane cap anyway
    var shift = Math.min(consecutiveFailures - 1, 62);
    var baseMillis = baseDelay.toMillis();
    long delayMillis;
    if (baseMillis > 0 && (1L << shift) > maxDelay.toMillis() / baseMillis) {
      delayMillis = maxDelay.toMillis();
    } else {
      delayMillis = Math.min(baseMillis << shift, maxDelay.toMillis());
    }
    var delay = Duration.ofMillis(delayMillis);
    if (isThrottling(statusCode)) {
      delay = delay.multipliedBy(throttleMultiplier);
    }
    return delay;
  }

  /**
   * Whether the status code signals that the remote service throttled us.
   */
  @Contract(value = "null -> false", pure = true)
  public boolean isThrottling(@Nullable Integer statusCode) {
    return statusCode != null && throttlingStatusCodes.contains(statusCode);
  }

  static int intProperty(Properties properties, String key, int fallback) {
    var raw = properties.getProperty(key);
    return raw == null ? fallback : parseInt(key, raw);
  }

  static Duration durationProperty(Properties properties, String key, Duration fallback) {
    var raw = properties.getProperty(key);
    if (raw == null) {
      return fallback;
    }
    try {
      return Duration.parse(raw.trim());
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Invalid duration for " + key + ": " + raw, e);
    }
  }

  private static int parseInt(String key, String raw) {
    try {
      return Integer.parseInt(raw.trim());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Invalid integer for " + key + ": " + raw, e);
    }
  }
}
