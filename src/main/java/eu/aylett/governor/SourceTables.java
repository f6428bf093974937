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

import com.google.common.collect.ImmutableMap;

import java.time.Duration;
import java.util.Properties;
import java.util.TreeSet;

/**
 * Source tables: the built-in budgets for the services we talk to, and a loader
 * for tables kept in properties files.
 */
public final class SourceTables {
  private static final String SOURCES_PREFIX = GovernorPolicy.PREFIX + "sources.";

  private static final ImmutableMap<String, SourceConfig> DEFAULTS = ImmutableMap.<String, SourceConfig>builder()
      .put("reddit", SourceConfig.perMinute(60, 10))
      .put("dexscreener", SourceConfig.perMinute(30, 5))
      .put("pumpfun", SourceConfig.perMinute(20, 5))
      .put("jupiter", SourceConfig.perMinute(30, 3))
      .put("helius", SourceConfig.perMinute(50, 1).withMinInterRequestDelay(Duration.ofMillis(350)))
      .put("googletrends", SourceConfig.perMinute(10, 5))
      .put("goplus", SourceConfig.perMinute(30, 5))
      .put("heliusws", SourceConfig.perMinute(100, 10))
      .put("pumpfunlaunch", SourceConfig.perMinute(10, 5))
      .put("dexscreenertrending", SourceConfig.perMinute(30, 5))
      .put("jupitertrending", SourceConfig.perMinute(20, 5))
      .put("telegram", SourceConfig.perMinute(30, 5))
      .build();

  private SourceTables() {
  }

  /**
   * The budgets of the public APIs the trend and safety scanners call. Names not
   * listed here (twitter, for one) are not throttled.
   */
  public static ImmutableMap<String, SourceConfig> defaults() {
    return DEFAULTS;
  }

  /**
   * Reads a table from {@code governor.sources.<name>.*} keys.
   * <p>
   * Each source needs {@code max-requests}, {@code window} and
   * {@code max-concurrent}; {@code min-delay} is optional. Durations use ISO-8601
   * notation, e.g. {@code PT1M}.
   * </p>
   *
   * @throws IllegalArgumentException
   *           if a required key is missing or a value is malformed
   */
  public static ImmutableMap<String, SourceConfig> fromProperties(Properties properties) {
    var names = new TreeSet<String>();
    for (var key : properties.stringPropertyNames()) {
      if (key.startsWith(SOURCES_PREFIX)) {
        var rest = key.substring(SOURCES_PREFIX.length());
        var dot = rest.lastIndexOf('.');
        if (dot > 0) {
          names.add(rest.substring(0, dot));
        }
      }
    }

    var table = ImmutableMap.<String, SourceConfig>builder();
    for (var name : names) {
      var prefix = SOURCES_PREFIX + name + ".";
      var maxRequests = GovernorPolicy.intProperty(properties, prefix + "max-requests", -1);
      var window = GovernorPolicy.durationProperty(properties, prefix + "window", Duration.ZERO);
      var maxConcurrent = GovernorPolicy.intProperty(properties, prefix + "max-concurrent", -1);
      var minDelay = GovernorPolicy.durationProperty(properties, prefix + "min-delay", Duration.ZERO);
      try {
        table.put(name, new SourceConfig(maxRequests, window, maxConcurrent, minDelay));
      } catch (IllegalArgumentException e) {
        throw new IllegalArgumentException("Invalid source configuration under " + prefix + "*: " + e.getMessage(), e);
      }
    }
    return table.build();
  }
}
