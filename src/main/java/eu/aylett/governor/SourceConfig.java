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

import java.time.Duration;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

/**
 * Throughput and concurrency budget for one source.
 *
 * @param maxRequestsPerWindow
 *          admissions allowed in any rolling {@code windowDuration}
 * @param windowDuration
 *          the length of the sliding window
 * @param maxConcurrent
 *          admitted calls that may be outstanding at once
 * @param minInterRequestDelay
 *          minimum spacing between consecutive admissions; zero disables it
 */
public record SourceConfig(int maxRequestsPerWindow, Duration windowDuration, int maxConcurrent,
    Duration minInterRequestDelay) {

  public SourceConfig {
    requireNonNull(windowDuration, "windowDuration");
    requireNonNull(minInterRequestDelay, "minInterRequestDelay");
    checkArgument(maxRequestsPerWindow > 0, "maxRequestsPerWindow must be > 0, was %s", maxRequestsPerWindow);
    checkArgument(!windowDuration.isNegative() && !windowDuration.isZero(), "windowDuration must be > 0, was %s",
        windowDuration);
    checkArgument(maxConcurrent > 0, "maxConcurrent must be > 0, was %s", maxConcurrent);
    checkArgument(!minInterRequestDelay.isNegative(), "minInterRequestDelay must be >= 0, was %s",
        minInterRequestDelay);
  }

  /**
   * A budget of {@code maxRequests} per minute with no minimum spacing.
   */
  public static SourceConfig perMinute(int maxRequests, int maxConcurrent) {
    return new SourceConfig(maxRequests, Duration.ofMinutes(1), maxConcurrent, Duration.ZERO);
  }

  /**
   * Returns a copy of this budget with the given minimum spacing.
   */
  public SourceConfig withMinInterRequestDelay(Duration delay) {
    return new SourceConfig(maxRequestsPerWindow, windowDuration, maxConcurrent, delay);
  }

  boolean hasMinInterRequestDelay() {
    return !minInterRequestDelay.isZero();
  }
}
