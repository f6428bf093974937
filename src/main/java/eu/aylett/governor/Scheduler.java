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
import java.util.concurrent.RejectedExecutionException;

/**
 * Runs a task once after a delay. Every timed wait in the governor is a single
 * scheduled task, never a polling loop.
 */
public interface Scheduler {
  /**
   * Run {@code task} once, no sooner than {@code delay} from now.
   *
   * @throws RejectedExecutionException
   *           if the scheduler can no longer accept tasks
   */
  void schedule(Runnable task, Duration delay);
}
