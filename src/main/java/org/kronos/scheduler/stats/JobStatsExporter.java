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
package org.kronos.scheduler.stats;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractIdleService;

import org.kronos.common.stats.StatsProvider;
import org.kronos.common.util.Clock;
import org.kronos.scheduler.cache.JobCache;

import static java.util.Objects.requireNonNull;

/**
 * Exports gauges summarizing the cached jobs.
 */
public class JobStatsExporter extends AbstractIdleService {
  @VisibleForTesting
  static final String ACTIVE_JOBS = "jobs_active";
  @VisibleForTesting
  static final String DISABLED_JOBS = "jobs_disabled";
  @VisibleForTesting
  static final String JOB_SUCCESSES = "job_success_count";
  @VisibleForTesting
  static final String JOB_ERRORS = "job_error_count";

  private final JobCache cache;
  private final Clock clock;
  private final StatsProvider statsProvider;

  @Inject
  JobStatsExporter(JobCache cache, Clock clock, StatsProvider statsProvider) {
    this.cache = requireNonNull(cache);
    this.clock = requireNonNull(clock);
    this.statsProvider = requireNonNull(statsProvider);
  }

  /**
   * Summarizes the jobs currently cached.
   *
   * @return A fresh summary.
   */
  public SchedulerStats snapshot() {
    return SchedulerStats.of(cache.getAll(), clock.nowInstant());
  }

  @Override
  protected void startUp() {
    statsProvider.makeGauge(ACTIVE_JOBS, () -> snapshot().getActiveJobs());
    statsProvider.makeGauge(DISABLED_JOBS, () -> snapshot().getDisabledJobs());
    statsProvider.makeGauge(JOB_SUCCESSES, () -> snapshot().getSuccessCount());
    statsProvider.makeGauge(JOB_ERRORS, () -> snapshot().getErrorCount());
  }

  @Override
  protected void shutDown() {
    // Nothing to do - await VM shutdown.
  }
}
