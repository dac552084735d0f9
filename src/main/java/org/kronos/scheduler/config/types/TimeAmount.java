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
package org.kronos.scheduler.config.types;

import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.Objects;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A non-negative amount of time given on the command line, such as {@code 30secs}.
 */
public class TimeAmount {

  /**
   * Units accepted on the command line, named by their flag suffix.
   */
  public enum Unit {
    NANOSECONDS("ns", ChronoUnit.NANOS),
    MICROSECONDS("us", ChronoUnit.MICROS),
    MILLISECONDS("ms", ChronoUnit.MILLIS),
    SECONDS("secs", ChronoUnit.SECONDS),
    MINUTES("mins", ChronoUnit.MINUTES),
    HOURS("hrs", ChronoUnit.HOURS),
    DAYS("days", ChronoUnit.DAYS);

    private final String display;
    private final ChronoUnit chronoUnit;

    Unit(String display, ChronoUnit chronoUnit) {
      this.display = display;
      this.chronoUnit = chronoUnit;
    }

    @Override
    public String toString() {
      return display;
    }
  }

  private final long value;
  private final Unit unit;

  public TimeAmount(long value, Unit unit) {
    checkArgument(value >= 0, "Time amount must not be negative");
    this.value = value;
    this.unit = requireNonNull(unit);
  }

  public long getValue() {
    return value;
  }

  public Unit getUnit() {
    return unit;
  }

  public Duration asDuration() {
    return Duration.of(value, unit.chronoUnit);
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof TimeAmount)) {
      return false;
    }
    TimeAmount other = (TimeAmount) o;
    return value == other.value && unit == other.unit;
  }

  @Override
  public int hashCode() {
    return Objects.hash(value, unit);
  }

  @Override
  public String toString() {
    return value + unit.toString();
  }
}
