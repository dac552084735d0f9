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
package org.kronos.scheduler.job;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

/**
 * Running totals of a job's run outcomes.
 */
public final class JobMetadata {
  public static final JobMetadata EMPTY = new JobMetadata(0, 0, null, null, null, 0);

  private final long successCount;
  private final long errorCount;
  private final Instant lastSuccess;
  private final Instant lastError;
  private final Instant lastAttemptedRun;
  private final long numberOfFinishedRuns;

  public JobMetadata(
      long successCount,
      long errorCount,
      Instant lastSuccess,
      Instant lastError,
      Instant lastAttemptedRun,
      long numberOfFinishedRuns) {

    this.successCount = successCount;
    this.errorCount = errorCount;
    this.lastSuccess = lastSuccess;
    this.lastError = lastError;
    this.lastAttemptedRun = lastAttemptedRun;
    this.numberOfFinishedRuns = numberOfFinishedRuns;
  }

  public long getSuccessCount() {
    return successCount;
  }

  public long getErrorCount() {
    return errorCount;
  }

  public Optional<Instant> getLastSuccess() {
    return Optional.ofNullable(lastSuccess);
  }

  public Optional<Instant> getLastError() {
    return Optional.ofNullable(lastError);
  }

  public Optional<Instant> getLastAttemptedRun() {
    return Optional.ofNullable(lastAttemptedRun);
  }

  public long getNumberOfFinishedRuns() {
    return numberOfFinishedRuns;
  }

  /**
   * Records the outcome of a finished run.
   *
   * @param run A run in a terminal state.
   * @return Updated metadata.
   */
  public JobMetadata recordRun(JobStat run) {
    requireNonNull(run);
    Instant finished = run.getFinishedAt().orElseThrow(
        () -> new IllegalArgumentException("Run " + run.getId() + " has not finished"));
    if (run.getStatus() == RunStatus.SUCCEEDED) {
      return new JobMetadata(
          successCount + 1,
          errorCount,
          finished,
          lastError,
          run.getStartedAt(),
          numberOfFinishedRuns + 1);
    } else {
      return new JobMetadata(
          successCount,
          errorCount + 1,
          lastSuccess,
          finished,
          run.getStartedAt(),
          numberOfFinishedRuns + 1);
    }
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof JobMetadata)) {
      return false;
    }
    JobMetadata other = (JobMetadata) o;
    return successCount == other.successCount
        && errorCount == other.errorCount
        && numberOfFinishedRuns == other.numberOfFinishedRuns
        && Objects.equals(lastSuccess, other.lastSuccess)
        && Objects.equals(lastError, other.lastError)
        && Objects.equals(lastAttemptedRun, other.lastAttemptedRun);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        successCount,
        errorCount,
        lastSuccess,
        lastError,
        lastAttemptedRun,
        numberOfFinishedRuns);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("successCount", successCount)
        .add("errorCount", errorCount)
        .add("lastSuccess", lastSuccess)
        .add("lastError", lastError)
        .add("lastAttemptedRun", lastAttemptedRun)
        .add("numberOfFinishedRuns", numberOfFinishedRuns)
        .toString();
  }
}
