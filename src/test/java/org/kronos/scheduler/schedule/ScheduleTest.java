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
import java.time.ZoneOffset;

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ScheduleTest {

  @Test
  public void testParse() throws Exception {
    Schedule schedule = Schedule.parse("R2/2024-01-01T00:00:00Z/P1D");
    assertEquals(2, schedule.getRepeat());
    assertFalse(schedule.isIndefinite());
    assertEquals(Instant.parse("2024-01-01T00:00:00Z"), schedule.getStartInstant());
    assertEquals(ZoneOffset.UTC, schedule.getOffset());
    assertEquals(CalendarDuration.parse("P1D"), schedule.getInterval());
  }

  @Test
  public void testIndefinite() throws Exception {
    Schedule schedule = Schedule.parse("R/2024-03-01T08:30:00+02:00/PT15M");
    assertTrue(schedule.isIndefinite());
    assertEquals(Schedule.INDEFINITE, schedule.getRepeat());
    assertEquals(ZoneOffset.ofHours(2), schedule.getOffset());
    assertEquals(Instant.parse("2024-03-01T06:30:00Z"), schedule.getStartInstant());
  }

  @Test
  public void testOneShotWithZeroInterval() throws Exception {
    Schedule schedule = Schedule.parse("R0/2024-01-01T00:00:00Z/PT0S");
    assertEquals(0, schedule.getRepeat());
    assertTrue(schedule.getInterval().isZero());
  }

  @Test
  public void testSpecRoundTrip() throws Exception {
    for (String spec : new String[] {
        "R2/2024-01-01T00:00:00Z/P1D",
        "R/2024-03-01T08:30:00+02:00/PT15M",
        "R10/2023-12-31T23:59:59-05:00/P1M2DT3H"}) {

      Schedule schedule = Schedule.parse(spec);
      assertEquals(spec, schedule.toSpec());
      assertEquals(schedule, Schedule.parse(schedule.toSpec()));
    }
  }

  @Test
  public void testMalformed() {
    for (String spec : new String[] {
        "",
        "R2/2024-01-01T00:00:00Z",
        "R2/2024-01-01T00:00:00Z/P1D/extra",
        "X2/2024-01-01T00:00:00Z/P1D",
        "R-1/2024-01-01T00:00:00Z/P1D",
        "R2/not-a-date/P1D",
        "R2/2024-01-01T00:00:00/P1D",
        "R2/2024-01-01T00:00:00Z/P1X",
        "R2/2024-01-01T00:00:00Z/PT0S",
        "R99999999999999999999/2024-01-01T00:00:00Z/P1D",
        "R/2024-01-01T00:00:00Z/P999999999Y",
        "R/2024-01-01T00:00:00Z/PT9999999999999999H",
        "R/2024-01-01T00:00:00Z/P2000000000000000000W"}) {
      try {
        Schedule.parse(spec);
        fail("Expected " + spec + " to be rejected");
      } catch (MalformedScheduleException e) {
        // Expected.
      }
    }
  }

  @Test(expected = MalformedScheduleException.class)
  public void testNull() throws Exception {
    Schedule.parse(null);
  }

  @Test
  public void testHugeIntervalOnOneShot() throws Exception {
    Schedule once = Schedule.parse("R0/2024-01-01T00:00:00Z/P999999999Y");
    assertEquals(0, once.getRepeat());
  }
}
