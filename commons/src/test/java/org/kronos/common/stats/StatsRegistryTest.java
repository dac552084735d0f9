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

import java.util.List;
import java.util.concurrent.atomic.AtomicLong;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Lists;

import org.junit.Before;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class StatsRegistryTest {

  private StatsRegistry registry;

  @Before
  public void setUp() {
    registry = new StatsRegistry();
  }

  @Test
  public void testCounter() {
    AtomicLong counter = registry.makeCounter("requests");
    assertEquals(0L, registry.getLongValue("requests"));
    counter.addAndGet(3);
    assertEquals(3L, registry.getLongValue("requests"));
  }

  @Test
  public void testGaugeIsReadOnDemand() {
    AtomicLong backing = new AtomicLong(5);
    Stat<Long> gauge = registry.makeGauge("backing", backing::get);
    assertEquals("backing", gauge.getName());
    backing.set(7);
    assertEquals(Long.valueOf(7), gauge.read());
    assertEquals(7L, registry.getLongValue("backing"));
  }

  @Test
  public void testExportSize() {
    List<String> items = Lists.newArrayList("a");
    registry.exportSize("items", items);
    items.add("b");
    assertEquals(2L, registry.getLongValue("items"));
  }

  @Test
  public void testNameNormalized() {
    assertEquals("a_b", StatsRegistry.normalizeName("a b"));
    assertEquals("a.b/c-d_e", StatsRegistry.normalizeName("a.b/c-d_e"));

    registry.makeCounter("bad name");
    assertEquals(0L, registry.getLongValue("bad_name"));
  }

  @Test
  public void testMissingStat() {
    assertNull(registry.getValue("missing"));
  }

  @Test(expected = IllegalArgumentException.class)
  public void testMissingLongStat() {
    registry.getLongValue("missing");
  }

  @Test(expected = IllegalArgumentException.class)
  public void testBlankName() {
    registry.makeCounter("");
  }

  @Test
  public void testSampleSorted() {
    registry.makeCounter("b").incrementAndGet();
    registry.makeCounter("a");
    assertEquals(ImmutableList.of("a", "b"),
        ImmutableList.copyOf(registry.sample().keySet()));
    assertEquals(ImmutableMap.of("a", 0L, "b", 1L), registry.sample());
  }
}
