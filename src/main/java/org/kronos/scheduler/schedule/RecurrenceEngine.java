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
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Computes due instants for schedules.  All functions are pure: the current time is always
 * supplied by the caller.
 */
public final class RecurrenceEngine {

  private RecurrenceEngine() {
    // Utility class.
  }

  /**
   * Computes the first due instant of a schedule.
   *
   * @param schedule Schedule to evaluate, absent for jobs that run once as soon as possible.
   * @param now Current time.
   * @return The start instant if it lies in the future, otherwise {@code now}.
   */
  public static Instant firstDue(Optional<Schedule> schedule, Instant now) {
    requireNonNull(now);
    return schedule
        .map(Schedule::getStartInstant)
        .filter(start -> start.isAfter(now))
        .orElse(now);
  }

  /**
   * Computes the due instant following {@code lastDue}, skipping every occurrence that is not
   * strictly after {@code reference}.  Missed occurrences therefore collapse into a single future
   * occurrence.
   *
   * @param schedule Schedule to evaluate.
   * @param lastDue The most recent due instant of the job.
   * @param reference Instant the result must be strictly after, usually the current time.
   * @param remainingRepeats Repetitions left, or {@link Schedule#INDEFINITE}.
   * @return The next due instant, or empty if no repetitions remain or the next occurrence lies
   *     beyond the range of representable instants.
   */
  public static Optional<Instant> nextDue(
      Schedule schedule,
      Instant lastDue,
      Instant reference,
      long remainingRepeats) {

    requireNonNull(schedule);
    requireNonNull(lastDue);
    requireNonNull(reference);
    checkArgument(remainingRepeats >= Schedule.INDEFINITE, "Invalid repeat count");

    if (remainingRepeats == 0) {
      return Optional.empty();
    }

    CalendarDuration interval = schedule.getInterval();
    checkArgument(!interval.isZero(), "Repeating schedule must have a non-empty interval");

    try {
      if (interval.isFixedLength()) {
        return Optional.of(nextFixed(interval.toFixedDuration(), lastDue, reference));
      }

      Instant next = interval.addTo(lastDue, schedule.getOffset());
      while (!next.isAfter(reference)) {
        next = interval.addTo(next, schedule.getOffset());
      }
      return Optional.of(next);
    } catch (DateTimeException | ArithmeticException e) {
      return Optional.empty();
    }
  }

  // Equivalent to repeated addition, without iterating over every missed occurrence.
  private static Instant nextFixed(Duration step, Instant lastDue, Instant reference) {
    Instant next = lastDue.plus(step);
    if (next.isAfter(reference)) {
      return next;
    }
    long stepMillis = step.toMillis();
    long behindMillis = Duration.between(next, reference).toMillis();
    long skipped = behindMillis / stepMillis + 1;
    next = next.plus(step.multipliedBy(skipped));
    while (!next.isAfter(reference)) {
      next = next.plus(step);
    }
    return next;
  }
}
