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

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.Year;
import java.time.ZoneOffset;
import java.util.Optional;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class RecurrenceEngineTest {

  private static final Instant JAN_1 = Instant.parse("2024-01-01T00:00:00Z");

  private static Schedule schedule(String spec) throws MalformedScheduleException {
    return Schedule.parse(spec);
  }

  @Test
  public void testFirstDueWithoutSchedule() {
    assertEquals(JAN_1, RecurrenceEngine.firstDue(Optional.empty(), JAN_1));
  }

  @Test
  public void testFirstDueFutureStart() throws Exception {
    Instant now = JAN_1.minusSeconds(60);
    assertEquals(
        JAN_1,
        RecurrenceEngine.firstDue(Optional.of(schedule("R2/2024-01-01T00:00:00Z/P1D")), now));
  }

  @Test
  public void testFirstDuePastStart() throws Exception {
    Instant now = Instant.parse("2024-02-01T12:00:00Z");
    assertEquals(
        now,
        RecurrenceEngine.firstDue(Optional.of(schedule("R2/2024-01-01T00:00:00Z/P1D")), now));
  }

  @Test
  public void testDailyRepeats() throws Exception {
    Schedule daily = schedule("R2/2024-01-01T00:00:00Z/P1D");
    assertEquals(
        Optional.of(Instant.parse("2024-01-02T00:00:00Z")),
        RecurrenceEngine.nextDue(daily, JAN_1, JAN_1.plusSeconds(1), 2));
    assertEquals(
        Optional.of(Instant.parse("2024-01-03T00:00:00Z")),
        RecurrenceEngine.nextDue(
            daily,
            Instant.parse("2024-01-02T00:00:00Z"),
            Instant.parse("2024-01-02T00:00:01Z"),
            1));
    assertEquals(
        Optional.empty(),
        RecurrenceEngine.nextDue(
            daily,
            Instant.parse("2024-01-03T00:00:00Z"),
            Instant.parse("2024-01-03T00:00:01Z"),
            0));
  }

  @Test
  public void testMissedOccurrencesCollapse() throws Exception {
    Schedule daily = schedule("R/2024-01-01T00:00:00Z/P1D");
    assertEquals(
        Optional.of(Instant.parse("2024-01-06T00:00:00Z")),
        RecurrenceEngine.nextDue(
            daily,
            JAN_1,
            Instant.parse("2024-01-05T12:00:00Z"),
            Schedule.INDEFINITE));
  }

  @Test
  public void testNextDueStrictlyAfterReference() throws Exception {
    Schedule daily = schedule("R/2024-01-01T00:00:00Z/P1D");
    assertEquals(
        Optional.of(Instant.parse("2024-01-04T00:00:00Z")),
        RecurrenceEngine.nextDue(
            daily,
            JAN_1,
            Instant.parse("2024-01-03T00:00:00Z"),
            Schedule.INDEFINITE));
  }

  @Test
  public void testMonthlyInterval() throws Exception {
    Schedule monthly = schedule("R/2024-01-31T10:00:00Z/P1M");
    Instant lastDue = Instant.parse("2024-01-31T10:00:00Z");
    assertEquals(
        Optional.of(Instant.parse("2024-02-29T10:00:00Z")),
        RecurrenceEngine.nextDue(monthly, lastDue, lastDue, Schedule.INDEFINITE));
  }

  @Test
  public void testMissedMonths() throws Exception {
    Schedule monthly = schedule("R/2024-01-15T00:00:00Z/P1M");
    assertEquals(
        Optional.of(Instant.parse("2024-05-15T00:00:00Z")),
        RecurrenceEngine.nextDue(
            monthly,
            Instant.parse("2024-01-15T00:00:00Z"),
            Instant.parse("2024-04-20T00:00:00Z"),
            Schedule.INDEFINITE));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testInvalidRepeats() throws Exception {
    RecurrenceEngine.nextDue(schedule("R/2024-01-01T00:00:00Z/P1D"), JAN_1, JAN_1, -2);
  }

  @Test
  public void testCalendarOccurrenceBeyondMaxYear() throws Exception {
    Schedule yearly = schedule("R/2024-01-01T00:00:00Z/P1Y");
    Instant lastDue = OffsetDateTime.of(Year.MAX_VALUE, 6, 1, 0, 0, 0, 0, ZoneOffset.UTC).toInstant();
    assertEquals(
        Optional.empty(),
        RecurrenceEngine.nextDue(yearly, lastDue, lastDue, Schedule.INDEFINITE));
  }

  @Test
  public void testFixedOccurrenceBeyondMaxInstant() throws Exception {
    Schedule hourly = schedule("R/2024-01-01T00:00:00Z/PT1H");
    Instant lastDue = Instant.MAX.minusSeconds(10);
    assertEquals(
        Optional.empty(),
        RecurrenceEngine.nextDue(hourly, lastDue, lastDue, Schedule.INDEFINITE));
  }
}
