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
package org.kronos.scheduler.pruning;

import java.time.Duration;

import org.junit.Before;
import org.junit.Test;
import org.kronos.common.stats.StatsRegistry;
import org.kronos.common.testing.easymock.EasyMockTest;
import org.kronos.scheduler.storage.PersistenceException;
import org.kronos.scheduler.storage.RunStore;

import static org.easymock.EasyMock.expect;
import static org.junit.Assert.assertEquals;

public class RunHistoryPrunerTest extends EasyMockTest {

  private RunStore runStore;
  private StatsRegistry stats;
  private RunHistoryPruner pruner;

  @Before
  public void setUp() {
    runStore = createMock(RunStore.class);
    stats = new StatsRegistry();
    pruner = new RunHistoryPruner(
        runStore,
        new RunHistoryPruner.HistoryPrunerSettings(Duration.ofMinutes(15)),
        stats);
  }

  @Test
  public void testPrunes() {
    expect(runStore.clearExpiredRuns()).andReturn(3);
    expect(runStore.clearExpiredRuns()).andReturn(0);

    control.replay();

    pruner.runForTest();
    pruner.runForTest();
    assertEquals(3L, stats.getLongValue(RunHistoryPruner.RUNS_PRUNED));
    assertEquals(0L, stats.getLongValue(RunHistoryPruner.PRUNE_ERRORS));
  }

  @Test
  public void testStoreFailureIsCounted() {
    expect(runStore.clearExpiredRuns()).andThrow(new PersistenceException("locked"));
    expect(runStore.clearExpiredRuns()).andReturn(1);

    control.replay();

    pruner.runForTest();
    pruner.runForTest();
    assertEquals(1L, stats.getLongValue(RunHistoryPruner.RUNS_PRUNED));
    assertEquals(1L, stats.getLongValue(RunHistoryPruner.PRUNE_ERRORS));
  }
}
