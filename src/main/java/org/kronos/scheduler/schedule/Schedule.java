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

import java.time.DateTimeException;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;

import static java.util.Objects.requireNonNull;

/**
 * A parsed schedule specification of the form {@code R[n]/<start>/<interval>}.
 *
 * <p>
 * {@code Rn} asks for {@code n} repetitions after the first occurrence, so a job fires
 * {@code n + 1} times in total; a bare {@code R} repeats indefinitely.  The start is an ISO-8601
 * date-time with offset, e.g. {@code 2024-01-01T00:00:00Z}, and the interval a
 * {@link CalendarDuration}.
 */
public final class Schedule {
  /**
   * Repeat count of a schedule that never exhausts.
   */
  public static final long INDEFINITE = -1;

  private static final Splitter COMPONENT_SPLITTER = Splitter.on('/');

  private final long repeat;
  private final OffsetDateTime start;
  private final CalendarDuration interval;

  public Schedule(long repeat, OffsetDateTime start, CalendarDuration interval) {
    this.repeat = repeat;
    this.start = requireNonNull(start);
    this.interval = requireNonNull(interval);
  }

  /**
   * Parses a schedule specification.
   *
   * @param spec Schedule string.
   * @return The parsed schedule.
   * @throws MalformedScheduleException If the specification does not decompose into exactly three
   *     well-formed components, or a repeating schedule has an empty interval.
   */
  public static Schedule parse(String spec) throws MalformedScheduleException {
    if (spec == null) {
      throw new MalformedScheduleException("Schedule must not be null.");
    }
    List<String> parts = COMPONENT_SPLITTER.splitToList(spec);
    if (parts.size() != 3) {
      throw new MalformedScheduleException(
          "Schedule must have exactly three '/'-separated components: " + spec);
    }

    long repeat = parseRepeat(parts.get(0), spec);

    OffsetDateTime start;
    try {
      start = OffsetDateTime.parse(parts.get(1), DateTimeFormatter.ISO_OFFSET_DATE_TIME);
    } catch (DateTimeParseException e) {
      throw new MalformedScheduleException("Malformed start time in schedule: " + spec, e);
    }

    CalendarDuration interval = CalendarDuration.parse(parts.get(2));
    if (repeat != 0) {
      if (interval.isZero()) {
        throw new MalformedScheduleException("Repeating schedule has an empty interval: " + spec);
      }
      checkApplicable(interval, start, spec);
    }

    return new Schedule(repeat, start, interval);
  }

  private static void checkApplicable(CalendarDuration interval, OffsetDateTime start, String spec)
      throws MalformedScheduleException {

    try {
      if (interval.isFixedLength()) {
        interval.toFixedDuration().toMillis();
      }
      interval.addTo(start.toInstant(), start.getOffset());
    } catch (DateTimeException | ArithmeticException e) {
      throw new MalformedScheduleException("Interval is out of range in schedule: " + spec, e);
    }
  }

  private static long parseRepeat(String value, String spec) throws MalformedScheduleException {
    if (!value.startsWith("R")) {
      throw new MalformedScheduleException("Repeat component must start with 'R': " + spec);
    }
    String count = value.substring(1);
    if (count.isEmpty()) {
      return INDEFINITE;
    }
    if (!count.chars().allMatch(Character::isDigit)) {
      throw new MalformedScheduleException("Malformed repeat count in schedule: " + spec);
    }
    try {
      return Long.parseLong(count);
    } catch (NumberFormatException e) {
      throw new MalformedScheduleException("Repeat count out of range in schedule: " + spec, e);
    }
  }

  public long getRepeat() {
    return repeat;
  }

  public boolean isIndefinite() {
    return repeat == INDEFINITE;
  }

  public OffsetDateTime getStart() {
    return start;
  }

  public Instant getStartInstant() {
    return start.toInstant();
  }

  public ZoneOffset getOffset() {
    return start.getOffset();
  }

  public CalendarDuration getInterval() {
    return interval;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Schedule)) {
      return false;
    }
    Schedule other = (Schedule) o;
    return repeat == other.repeat
        && start.equals(other.start)
        && interval.equals(other.interval);
  }

  @Override
  public int hashCode() {
    return Objects.hash(repeat, start, interval);
  }

  /**
   * Formats the schedule in its specification form.
   *
   * @return A string that {@link #parse(String)} maps back to an equal schedule.
   */
  public String toSpec() {
    return "R" + (isIndefinite() ? "" : Long.toString(repeat))
        + "/" + DateTimeFormatter.ISO_OFFSET_DATE_TIME.format(start)
        + "/" + interval;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("repeat", repeat)
        .add("start", start)
        .add("interval", interval)
        .toString();
  }
}
