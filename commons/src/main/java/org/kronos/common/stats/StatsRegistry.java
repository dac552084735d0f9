/**
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.kronos.common.stats;

import java.util.Map;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.regex.Pattern;

import com.google.common.base.Strings;
import com.google.common.collect.ImmutableSortedMap;
import com.google.common.collect.Maps;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Manages {@link Stat}s that should be exported for monitoring.
 *
 * Statistic names may only contain {@code [A-Za-z0-9_/.-]},
 * all other chars will be logged as a warning and replaced with underscore on export.
 */
public class StatsRegistry implements StatsProvider {
  private static final Logger LOG = LoggerFactory.getLogger(StatsRegistry.class);
  private static final Pattern NOT_NAME_CHAR = Pattern.compile("[^A-Za-z0-9_/.-]");

  private final ConcurrentMap<String, Stat<? extends Number>> stats = Maps.newConcurrentMap();

  static String normalizeName(String name) {
    return NOT_NAME_CHAR.matcher(name).replaceAll("_");
  }

  private static String validateName(String name) {
    checkArgument(!Strings.isNullOrEmpty(name), "Stat name must not be blank.");
    String normalized = normalizeName(name);
    if (!name.equals(normalized)) {
      LOG.warn("Invalid stat name {} exported as {}", name, normalized);
    }
    return normalized;
  }

  private <T extends Number> Stat<T> export(String name, Supplier<T> value) {
    String validatedName = validateName(name);
    Stat<T> stat = new Stat<T>() {
      @Override
      public String getName() {
        return validatedName;
      }

      @Override
      public T read() {
        return value.get();
      }
    };
    if (stats.put(validatedName, stat) != null) {
      LOG.warn("Warning - exported variable collision on {}", validatedName);
    }
    return stat;
  }

  @Override
  public AtomicLong makeCounter(String name) {
    AtomicLong counter = new AtomicLong();
    export(name, counter::get);
    return counter;
  }

  @Override
  public <T extends Number> Stat<T> makeGauge(String name, Supplier<T> gauge) {
    return export(name, gauge);
  }

  /**
   * Gets the current value of a stat.
   *
   * @param name Name of the stat to fetch.
   * @return Current stat value, or {@code null} if no stat is exported under that name.
   */
  public Number getValue(String name) {
    Stat<? extends Number> stat = stats.get(name);
    return stat == null ? null : stat.read();
  }

  /**
   * Gets the current value of a long-valued stat.
   *
   * @param name Name of the stat to fetch.
   * @return Current stat value.
   * @throws IllegalArgumentException if no stat is exported under that name.
   */
  public long getLongValue(String name) {
    Number value = getValue(name);
    checkArgument(value != null, "No stat exported as %s", name);
    return value.longValue();
  }

  /**
   * Samples every exported stat.
   *
   * @return Stat values keyed and sorted by name.
   */
  public Map<String, Number> sample() {
    ImmutableSortedMap.Builder<String, Number> values = ImmutableSortedMap.naturalOrder();
    stats.forEach((name, stat) -> values.put(name, stat.read()));
    return values.build();
  }
}
