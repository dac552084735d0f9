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
package org.kronos.scheduler.storage.mem;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import javax.inject.Inject;
import javax.inject.Qualifier;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.kronos.common.stats.StatsProvider;
import org.kronos.common.util.Clock;
import org.kronos.scheduler.job.JobStat;
import org.kronos.scheduler.storage.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory run store.  Finished runs are kept for a retention window measured from their
 * finish time.
 */
class MemRunStore implements RunStore {
  private static final Logger LOG = LoggerFactory.getLogger(MemRunStore.class);

  @VisibleForTesting
  static final String RUNS_SIZE = "mem_storage_runs_size";

  /**
   * Binding annotation for the retention window of finished runs.
   */
  @Retention(RetentionPolicy.RUNTIME)
  @Target({ElementType.METHOD, ElementType.PARAMETER, ElementType.FIELD})
  @Qualifier
  public @interface RunRetention { }

  private static final Comparator<JobStat> BY_START = Comparator
      .comparing(JobStat::getStartedAt)
      .thenComparing(JobStat::getId);

  private final Map<String, JobStat> runs = Maps.newConcurrentMap();
  private final Clock clock;
  private final Duration retention;

  @Inject
  MemRunStore(StatsProvider statsProvider, Clock clock, @RunRetention Duration retention) {
    this.clock = requireNonNull(clock);
    this.retention = requireNonNull(retention);
    statsProvider.makeGauge(RUNS_SIZE, () -> runs.size());
  }

  @Override
  public void saveRun(JobStat run) {
    runs.put(run.getId(), run);
  }

  @Override
  public void updateRun(JobStat run) {
    runs.put(run.getId(), run);
  }

  @Override
  public Optional<JobStat> getRun(String runId) {
    return Optional.ofNullable(runs.get(requireNonNull(runId)));
  }

  @Override
  public List<JobStat> getAllRuns(String jobId) {
    requireNonNull(jobId);
    return runs.values().stream()
        .filter(run -> run.getJobId().equals(jobId))
        .sorted(BY_START)
        .collect(ImmutableList.toImmutableList());
  }

  @Override
  public void deleteRuns(String jobId) {
    requireNonNull(jobId);
    runs.values().removeIf(run -> run.getJobId().equals(jobId));
  }

  @Override
  public int clearExpiredRuns() {
    Instant cutoff = clock.nowInstant().minus(retention);
    int removed = 0;
    Iterator<JobStat> iterator = runs.values().iterator();
    while (iterator.hasNext()) {
      Optional<Instant> finished = iterator.next().getFinishedAt();
      if (finished.isPresent() && finished.get().isBefore(cutoff)) {
        iterator.remove();
        removed++;
      }
    }
    if (removed > 0) {
      LOG.info("Cleared {} runs that finished before {}", removed, cutoff);
    }
    return removed;
  }
}
