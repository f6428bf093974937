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

/**
 * Client-side protection for remote services that we don't control and that
 * fail in ordinary ways: slowly, intermittently, or by telling us to go away.
 * <p>
 * One {@link eu.aylett.governor.SourceGovernor} holds a budget per named source
 * and makes each caller wait its turn: a concurrency slot first, then any
 * backoff from recent failures, then the minimum spacing, then room in the
 * sliding window. After enough consecutive failures a source is treated as
 * unavailable and callers fail fast, so the pipeline above can substitute a
 * neutral value instead of queueing behind a dead endpoint.
 * </p>
 * <p>
 * There is no half-open probing. A source becomes available again when a call
 * admitted before the breaker opened, or a caller choosing to retry, reports a
 * success.
 * </p>
 */
@NullMarked
package eu.aylett.governor;

import org.jspecify.annotations.NullMarked;
