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
 * Implemented by exceptions that know the status code returned by the remote
 * service, so {@link SourceGovernor#checkedAttempt} can tell explicit throttling
 * apart from other failures.
 */
public interface StatusCodeCarrier {
  /**
   * The status code the remote service responded with, typically HTTP.
   */
  int statusCode();
}
