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

import java.time.Instant;

/**
 * A point-in-time copy of one source's admission state.
 *
 * @param source
 *          the source name
 * @param inFlight
 *          admitted calls not yet reported
 * @param queuedWaiters
 *          callers waiting for a concurrency slot
 * @param admissionsInWindow
 *          admissions recorded in the current sliding window
 * @param consecutiveFailures
 *          failures since the last reported success
 * @param backoffUntil
 *          the end of the active backoff, or null if none is active
 * @param unavailable
 *          whether the breaker is open
 */
public record SourceSnapshot(String source, int inFlight, int queuedWaiters, int admissionsInWindow,
    int consecutiveFailures, @Nullable Instant backoffUntil, boolean unavailable) {
}
