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
import java.util.UUID;

import com.google.common.base.MoreObjects;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkState;

/**
 * The record of one run of a job: a single execution together with its retries.
 */
public final class JobStat {
  private final String id;
  private final String jobId;
  private final Instant startedAt;
  private final Optional<Instant> finishedAt;
  private final RunStatus status;
  private final int attempts;
  private final Optional<String> errorDetail;
  private final boolean manual;

  public JobStat(
      String id,
      String jobId,
      Instant startedAt,
      Optional<Instant> finishedAt,
      RunStatus status,
      int attempts,
      Optional<String> errorDetail,
      boolean manual) {

    this.id = requireNonNull(id);
    this.jobId = requireNonNull(jobId);
    this.startedAt = requireNonNull(startedAt);
    this.finishedAt = requireNonNull(finishedAt);
    this.status = requireNonNull(status);
    this.errorDetail = requireNonNull(errorDetail);
    checkArgument(attempts >= 1, "A run makes at least one attempt");
    checkArgument(
        status.isTerminal() == finishedAt.isPresent(),
        "Only finished runs have a finish time");
    finishedAt.ifPresent(finished -> checkArgument(
        !finished.isBefore(startedAt),
        "Run cannot finish before it started"));
    this.attempts = attempts;
    this.manual = manual;
  }

  /**
   * Creates the record of a run that is about to execute its first attempt.
   *
   * @param jobId Job being run.
   * @param startedAt Start time of the run.
   * @param manual Whether the run was triggered outside the job's schedule.
   * @return A new running record.
   */
  public static JobStat started(String jobId, Instant startedAt, boolean manual) {
    return new JobStat(
        UUID.randomUUID().toString(),
        jobId,
        startedAt,
        Optional.empty(),
        RunStatus.RUNNING,
        1,
        Optional.empty(),
        manual);
  }

  /**
   * Records another attempt of a running run.
   *
   * @param errorDetail Failure of the previous attempt.
   * @return The updated record.
   */
  public JobStat retrying(String errorDetail) {
    checkState(status == RunStatus.RUNNING, "Run %s already finished", id);
    return new JobStat(
        id,
        jobId,
        startedAt,
        Optional.empty(),
        RunStatus.RUNNING,
        attempts + 1,
        Optional.of(errorDetail),
        manual);
  }

  public JobStat succeeded(Instant finished) {
    checkState(status == RunStatus.RUNNING, "Run %s already finished", id);
    return new JobStat(
        id,
        jobId,
        startedAt,
        Optional.of(finished),
        RunStatus.SUCCEEDED,
        attempts,
        Optional.empty(),
        manual);
  }

  public JobStat failed(Instant finished, String detail) {
    checkState(status == RunStatus.RUNNING, "Run %s already finished", id);
    return new JobStat(
        id,
        jobId,
        startedAt,
        Optional.of(finished),
        RunStatus.FAILED,
        attempts,
        Optional.of(detail),
        manual);
  }

  public String getId() {
    return id;
  }

  public String getJobId() {
    return jobId;
  }

  public Instant getStartedAt() {
    return startedAt;
  }

  public Optional<Instant> getFinishedAt() {
    return finishedAt;
  }

  public RunStatus getStatus() {
    return status;
  }

  public int getAttempts() {
    return attempts;
  }

  /**
   * Returns the number of retries consumed, one less than the attempts.
   *
   * @return Retries consumed by this run.
   */
  public int getRetries() {
    return attempts - 1;
  }

  public Optional<String> getErrorDetail() {
    return errorDetail;
  }

  public boolean isManual() {
    return manual;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof JobStat)) {
      return false;
    }
    JobStat other = (JobStat) o;
    return attempts == other.attempts
        && manual == other.manual
        && id.equals(other.id)
        && jobId.equals(other.jobId)
        && startedAt.equals(other.startedAt)
        && finishedAt.equals(other.finishedAt)
        && status == other.status
        && errorDetail.equals(other.errorDetail);
  }

  @Override
  public int hashCode() {
    return Objects.hash(id, jobId, startedAt, finishedAt, status, attempts, errorDetail, manual);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("jobId", jobId)
        .add("startedAt", startedAt)
        .add("finishedAt", finishedAt)
        .add("status", status)
        .add("attempts", attempts)
        .add("errorDetail", errorDetail)
        .add("manual", manual)
        .toString();
  }
}
