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
package org.kronos.scheduler.schedule;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.google.common.annotations.VisibleForTesting;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An ISO-8601 style duration that mixes calendar-relative units (years, months) with units of
 * fixed length (weeks, days, hours, minutes, seconds), e.g. {@code P1M2DT3H}.
 *
 * <p>
 * Calendar-relative units are applied to a date in a fixed offset, so adding {@code P1M} to
 * January 31st yields the last day of February.
 */
public final class CalendarDuration {
  private static final Pattern GRAMMAR = Pattern.compile(
      "P(?:(\\d+)Y)?(?:(\\d+)M)?(?:(\\d+)W)?(?:(\\d+)D)?(T(?:(\\d+)H)?(?:(\\d+)M)?(?:(\\d+)S)?)?");

  public static final CalendarDuration ZERO = new CalendarDuration(0, 0, 0, 0, 0, 0, 0);

  private final long years;
  private final long months;
  private final long weeks;
  private final long days;
  private final long hours;
  private final long minutes;
  private final long seconds;

  @VisibleForTesting
  CalendarDuration(
      long years,
      long months,
      long weeks,
      long days,
      long hours,
      long minutes,
      long seconds) {

    checkArgument(years >= 0 && months >= 0 && weeks >= 0 && days >= 0
        && hours >= 0 && minutes >= 0 && seconds >= 0, "Duration components must not be negative");
    this.years = years;
    this.months = months;
    this.weeks = weeks;
    this.days = days;
    this.hours = hours;
    this.minutes = minutes;
    this.seconds = seconds;
  }

  /**
   * Parses a duration such as {@code P1Y2M3W4DT5H6M7S}.  At least one designator must be present,
   * and a {@code T} separator must be followed by at least one time designator.
   *
   * @param value Duration string.
   * @return The parsed duration.
   * @throws MalformedScheduleException If {@code value} does not conform to the grammar.
   */
  public static CalendarDuration parse(String value) throws MalformedScheduleException {
    if (value == null) {
      throw new MalformedScheduleException("Duration must not be null.");
    }
    Matcher matcher = GRAMMAR.matcher(value);
    if (!matcher.matches()) {
      throw new MalformedScheduleException("Malformed duration: " + value);
    }

    boolean hasDateDesignator = matcher.group(1) != null || matcher.group(2) != null
        || matcher.group(3) != null || matcher.group(4) != null;
    boolean hasTimeSection = matcher.group(5) != null;
    boolean hasTimeDesignator =
        matcher.group(6) != null || matcher.group(7) != null || matcher.group(8) != null;
    if (hasTimeSection && !hasTimeDesignator) {
      throw new MalformedScheduleException("Empty time section in duration: " + value);
    }
    if (!hasDateDesignator && !hasTimeDesignator) {
      throw new MalformedScheduleException("Duration has no designators: " + value);
    }

    try {
      return new CalendarDuration(
          component(matcher.group(1)),
          component(matcher.group(2)),
          component(matcher.group(3)),
          component(matcher.group(4)),
          component(matcher.group(6)),
          component(matcher.group(7)),
          component(matcher.group(8)));
    } catch (NumberFormatException e) {
      throw new MalformedScheduleException("Duration component out of range: " + value, e);
    }
  }

  private static long component(String group) {
    return group == null ? 0 : Long.parseLong(group);
  }

  public long getYears() {
    return years;
  }

  public long getMonths() {
    return months;
  }

  public long getWeeks() {
    return weeks;
  }

  public long getDays() {
    return days;
  }

  public long getHours() {
    return hours;
  }

  public long getMinutes() {
    return minutes;
  }

  public long getSeconds() {
    return seconds;
  }

  public boolean isZero() {
    return equals(ZERO);
  }

  /**
   * Whether every occurrence of this duration spans the same amount of time.  Only years and
   * months vary in length, weeks and days are fixed when applied in a fixed offset.
   *
   * @return {@code true} if the duration contains no year or month component.
   */
  public boolean isFixedLength() {
    return years == 0 && months == 0;
  }

  /**
   * Gets the exact length of a fixed-length duration.
   *
   * @return The length of this duration.
   * @throws IllegalStateException If the duration has calendar-relative components.
   * @throws ArithmeticException If the length does not fit in a {@link Duration}.
   */
  public Duration toFixedDuration() {
    if (!isFixedLength()) {
      throw new IllegalStateException("Duration " + this + " has no fixed length.");
    }
    return Duration.ofDays(Math.addExact(Math.multiplyExact(weeks, 7L), days))
        .plusHours(hours)
        .plusMinutes(minutes)
        .plusSeconds(seconds);
  }

  /**
   * Adds this duration to an instant, interpreting calendar units in the given offset.
   *
   * @param instant Instant to add to.
   * @param offset Offset in which calendar units are applied.
   * @return {@code instant} advanced by this duration.
   * @throws java.time.DateTimeException If the result is outside the supported range.
   */
  public Instant addTo(Instant instant, ZoneOffset offset) {
    return ZonedDateTime.ofInstant(instant, offset)
        .plusYears(years)
        .plusMonths(months)
        .plusWeeks(weeks)
        .plusDays(days)
        .plusHours(hours)
        .plusMinutes(minutes)
        .plusSeconds(seconds)
        .toInstant();
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof CalendarDuration)) {
      return false;
    }
    CalendarDuration other = (CalendarDuration) o;
    return years == other.years
        && months == other.months
        && weeks == other.weeks
        && days == other.days
        && hours == other.hours
        && minutes == other.minutes
        && seconds == other.seconds;
  }

  @Override
  public int hashCode() {
    return Objects.hash(years, months, weeks, days, hours, minutes, seconds);
  }

  /**
   * Formats the duration in its canonical form, omitting zero components.
   *
   * @return A string that {@link #parse(String)} maps back to an equal duration.
   */
  @Override
  public String toString() {
    if (isZero()) {
      return "PT0S";
    }
    StringBuilder sb = new StringBuilder("P");
    append(sb, years, 'Y');
    append(sb, months, 'M');
    append(sb, weeks, 'W');
    append(sb, days, 'D');
    if (hours > 0 || minutes > 0 || seconds > 0) {
      sb.append('T');
      append(sb, hours, 'H');
      append(sb, minutes, 'M');
      append(sb, seconds, 'S');
    }
    return sb.toString();
  }

  private static void append(StringBuilder sb, long value, char designator) {
    if (value > 0) {
      sb.append(value).append(designator);
    }
  }
}
