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
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;

import org.kronos.common.stats.StatsProvider;
import org.kronos.scheduler.storage.PersistenceException;
import org.kronos.scheduler.storage.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Prunes expired run history on a periodic basis.  What counts as expired is up to the run store.
 */
class RunHistoryPruner extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(RunHistoryPruner.class);
  @VisibleForTesting
  static final String RUNS_PRUNED = "runs_pruned";
  @VisibleForTesting
  static final String PRUNE_ERRORS = "run_prune_errors";

  private final RunStore runStore;
  private final HistoryPrunerSettings settings;
  private final AtomicLong prunedRunsCount;
  private final AtomicLong pruneErrors;

  static class HistoryPrunerSettings {
    private final Duration pruneInterval;

    HistoryPrunerSettings(Duration pruneInterval) {
      this.pruneInterval = requireNonNull(pruneInterval);
    }
  }

  @Inject
  RunHistoryPruner(
      RunStore runStore,
      HistoryPrunerSettings settings,
      StatsProvider statsProvider) {

    this.runStore = requireNonNull(runStore);
    this.settings = requireNonNull(settings);
    this.prunedRunsCount = statsProvider.makeCounter(RUNS_PRUNED);
    this.pruneErrors = statsProvider.makeCounter(PRUNE_ERRORS);
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(
        settings.pruneInterval.toMillis(),
        settings.pruneInterval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  void runForTest() {
    runOneIteration();
  }

  @Override
  protected void runOneIteration() {
    int pruned;
    try {
      pruned = runStore.clearExpiredRuns();
    } catch (PersistenceException e) {
      pruneErrors.incrementAndGet();
      LOG.error("Failed to prune run history: " + e, e);
      return;
    }

    prunedRunsCount.addAndGet(pruned);
    LOG.info(pruned == 0
        ? "No run history to prune."
        : "Pruned " + pruned + " expired runs.");
  }
}
