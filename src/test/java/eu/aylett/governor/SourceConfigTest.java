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

import com.google.common.testing.EqualsTester;
import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.equalTo;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class SourceConfigTest {
  @Test
  void perMinuteHasNoSpacing() {
    var config = SourceConfig.perMinute(30, 5);

    assertThat(config, equalTo(new SourceConfig(30, Duration.ofMinutes(1), 5, Duration.ZERO)));
    assertFalse(config.hasMinInterRequestDelay());
    assertTrue(config.withMinInterRequestDelay(Duration.ofMillis(350)).hasMinInterRequestDelay());
  }

  @Test
  void equalityAndHashcode() {
    new EqualsTester()
        .addEqualityGroup(SourceConfig.perMinute(30, 5), new SourceConfig(30, Duration.ofSeconds(60), 5, Duration.ZERO))
        .addEqualityGroup(SourceConfig.perMinute(30, 3))
        .addEqualityGroup(SourceConfig.perMinute(30, 5).withMinInterRequestDelay(Duration.ofMillis(350)))
        .addEqualityGroup(new SourceConfig(30, Duration.ofSeconds(30), 5, Duration.ZERO))
        .testEquals();
  }

  @Test
  void rejectsEmptyBudgets() {
    var noRequests = assertThrows(IllegalArgumentException.class,
        () -> new SourceConfig(0, Duration.ofMinutes(1), 1, Duration.ZERO));
    assertThat(noRequests.getMessage(), containsString("maxRequestsPerWindow"));

    assertThrows(IllegalArgumentException.class, () -> new SourceConfig(1, Duration.ZERO, 1, Duration.ZERO));
    assertThrows(IllegalArgumentException.class, () -> new SourceConfig(1, Duration.ofMinutes(1), 0, Duration.ZERO));
    assertThrows(IllegalArgumentException.class,
        () -> new SourceConfig(1, Duration.ofMinutes(1), 1, Duration.ofMillis(-1)));
  }
}
