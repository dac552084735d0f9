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

import java.time.Instant;
import java.util.Collection;
import java.util.Comparator;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import org.kronos.scheduler.job.Job;

import static java.util.Objects.requireNonNull;

/**
 * A point-in-time summary of the jobs known to the scheduler.
 */
public final class SchedulerStats {
  private final long activeJobs;
  private final long disabledJobs;
  private final long totalJobs;
  private final long successCount;
  private final long errorCount;
  private final Optional<Instant> nextRun;
  private final Optional<Instant> lastAttemptedRun;
  private final Instant createdAt;

  private SchedulerStats(
      long activeJobs,
      long disabledJobs,
      long totalJobs,
      long successCount,
      long errorCount,
      Optional<Instant> nextRun,
      Optional<Instant> lastAttemptedRun,
      Instant createdAt) {

    this.activeJobs = activeJobs;
    this.disabledJobs = disabledJobs;
    this.totalJobs = totalJobs;
    this.successCount = successCount;
    this.errorCount = errorCount;
    this.nextRun = requireNonNull(nextRun);
    this.lastAttemptedRun = requireNonNull(lastAttemptedRun);
    this.createdAt = requireNonNull(createdAt);
  }

  /**
   * Summarizes a set of jobs.
   *
   * @param jobs Jobs to summarize.
   * @param now Time the summary is taken.
   * @return The summary.
   */
  public static SchedulerStats of(Collection<Job> jobs, Instant now) {
    long disabled = jobs.stream().filter(Job::isDisabled).count();
    return new SchedulerStats(
        jobs.size() - disabled,
        disabled,
        jobs.size(),
        jobs.stream().mapToLong(job -> job.getMetadata().getSuccessCount()).sum(),
        jobs.stream().mapToLong(job -> job.getMetadata().getErrorCount()).sum(),
        jobs.stream()
            .filter(job -> !job.isDisabled())
            .map(Job::getNextRunAt)
            .flatMap(Optional::stream)
            .min(Comparator.naturalOrder()),
        jobs.stream()
            .map(job -> job.getMetadata().getLastAttemptedRun())
            .flatMap(Optional::stream)
            .max(Comparator.naturalOrder()),
        now);
  }

  public long getActiveJobs() {
    return activeJobs;
  }

  public long getDisabledJobs() {
    return disabledJobs;
  }

  public long getTotalJobs() {
    return totalJobs;
  }

  public long getSuccessCount() {
    return successCount;
  }

  public long getErrorCount() {
    return errorCount;
  }

  /**
   * Returns the earliest due instant among enabled jobs.
   *
   * @return Next due instant, empty if no job is armed.
   */
  public Optional<Instant> getNextRun() {
    return nextRun;
  }

  public Optional<Instant> getLastAttemptedRun() {
    return lastAttemptedRun;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("activeJobs", activeJobs)
        .add("disabledJobs", disabledJobs)
        .add("totalJobs", totalJobs)
        .add("successCount", successCount)
        .add("errorCount", errorCount)
        .add("nextRun", nextRun)
        .add("lastAttemptedRun", lastAttemptedRun)
        .add("createdAt", createdAt)
        .toString();
  }
}
