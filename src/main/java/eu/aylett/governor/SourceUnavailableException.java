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

/**
 * Thrown when a source's breaker is open and an admission is refused.
 * <p>
 * Callers are expected to catch this and substitute a neutral value, rather
 * than failing their own work.
 * </p>
 */
public class SourceUnavailableException extends RuntimeException {
  /**
   * The source whose breaker is open.
   */
  public final String source;
  /**
   * The number of consecutive failures recorded when the breaker was observed
   * open.
   */
  public final int consecutiveFailures;

  /**
   * Constructs a new SourceUnavailableException.
   *
   * @param source
   *          the source that refused admission
   * @param consecutiveFailures
   *          the consecutive failure count at the time of refusal
   */
  public SourceUnavailableException(String source, int consecutiveFailures) {
    super(source + " is unavailable after " + consecutiveFailures + " consecutive failures, skipping request");
    this.source = source;
    this.consecutiveFailures = consecutiveFailures;
  }
}
