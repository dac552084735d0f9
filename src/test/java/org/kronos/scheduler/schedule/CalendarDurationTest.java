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

import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class CalendarDurationTest {

  @Test
  public void testParseAllDesignators() throws Exception {
    CalendarDuration duration = CalendarDuration.parse("P1Y2M3W4DT5H6M7S");
    assertEquals(new CalendarDuration(1, 2, 3, 4, 5, 6, 7), duration);
    assertEquals("P1Y2M3W4DT5H6M7S", duration.toString());
  }

  @Test
  public void testMonthsAndMinutes() throws Exception {
    assertEquals(1, CalendarDuration.parse("P1M").getMonths());
    assertEquals(0, CalendarDuration.parse("P1M").getMinutes());
    assertEquals(1, CalendarDuration.parse("PT1M").getMinutes());
    assertEquals(0, CalendarDuration.parse("PT1M").getMonths());
  }

  @Test
  public void testCanonicalForm() throws Exception {
    assertEquals("P1D", CalendarDuration.parse("P0Y1D").toString());
    assertEquals("PT0S", CalendarDuration.parse("PT0S").toString());
    assertTrue(CalendarDuration.parse("PT0S").isZero());
  }

  @Test
  public void testMalformed() {
    for (String value : new String[] {"", "P", "PT", "1D", "P-1D", "P1DT", "P1.5D", "p1d", "P1H"}) {
      try {
        CalendarDuration.parse(value);
        fail("Expected " + value + " to be rejected");
      } catch (MalformedScheduleException e) {
        // Expected.
      }
    }
  }

  @Test(expected = MalformedScheduleException.class)
  public void testNull() throws Exception {
    CalendarDuration.parse(null);
  }

  @Test
  public void testFixedLength() throws Exception {
    CalendarDuration fixed = CalendarDuration.parse("P1W2DT3H");
    assertTrue(fixed.isFixedLength());
    assertEquals(Duration.ofDays(9).plusHours(3), fixed.toFixedDuration());
    assertFalse(CalendarDuration.parse("P1M").isFixedLength());
    assertFalse(CalendarDuration.parse("P1Y").isFixedLength());
  }

  @Test(expected = IllegalStateException.class)
  public void testNoFixedLength() throws Exception {
    CalendarDuration.parse("P1M").toFixedDuration();
  }

  @Test
  public void testAddMonthClampsToEndOfMonth() throws Exception {
    Instant endOfJanuary = Instant.parse("2024-01-31T10:00:00Z");
    assertEquals(
        Instant.parse("2024-02-29T10:00:00Z"),
        CalendarDuration.parse("P1M").addTo(endOfJanuary, ZoneOffset.UTC));
  }

  @Test
  public void testAddDayInOffset() throws Exception {
    Instant start = Instant.parse("2024-03-01T22:30:00Z");
    assertEquals(
        Instant.parse("2024-03-02T22:30:00Z"),
        CalendarDuration.parse("P1D").addTo(start, ZoneOffset.ofHours(2)));
  }
}
