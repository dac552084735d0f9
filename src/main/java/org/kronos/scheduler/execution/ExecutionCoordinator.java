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
package org.kronos.scheduler.execution;

import java.time.Instant;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;

import org.kronos.common.stats.StatsProvider;
import org.kronos.common.util.BackoffStrategy;
import org.kronos.common.util.Clock;
import org.kronos.scheduler.cache.Firing;
import org.kronos.scheduler.cache.JobRunner;
import org.kronos.scheduler.events.EventSink;
import org.kronos.scheduler.events.PubsubEvent.RunFinished;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.job.JobStat;
import org.kronos.scheduler.schedule.MalformedScheduleException;
import org.kronos.scheduler.schedule.RecurrenceEngine;
import org.kronos.scheduler.schedule.Schedule;
import org.kronos.scheduler.storage.PersistenceException;
import org.kronos.scheduler.storage.RunStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Turns a due job into a recorded run.  A run is saved before its first attempt, failed attempts
 * are retried after a backoff until the job's retries are used up, and the final outcome is saved
 * before the job is rescheduled or retired.
 */
public class ExecutionCoordinator implements JobRunner {
  private static final Logger LOG = LoggerFactory.getLogger(ExecutionCoordinator.class);

  @VisibleForTesting
  static final String RUNS_SUCCEEDED = "job_runs_succeeded";
  @VisibleForTesting
  static final String RUNS_FAILED = "job_runs_failed";
  @VisibleForTesting
  static final String RUN_ATTEMPTS = "job_run_attempts";
  @VisibleForTesting
  static final String RUN_PERSISTENCE_ERRORS = "run_persistence_errors";

  private final RunStore runStore;
  private final CommandRunner commandRunner;
  private final RemoteInvoker remoteInvoker;
  private final BackoffStrategy backoff;
  private final Clock clock;
  private final EventSink eventSink;
  private final AtomicLong runsSucceeded;
  private final AtomicLong runsFailed;
  private final AtomicLong runAttempts;
  private final AtomicLong persistenceErrors;

  @Inject
  ExecutionCoordinator(
      RunStore runStore,
      CommandRunner commandRunner,
      RemoteInvoker remoteInvoker,
      BackoffStrategy backoff,
      Clock clock,
      EventSink eventSink,
      StatsProvider statsProvider) {

    this.runStore = requireNonNull(runStore);
    this.commandRunner = requireNonNull(commandRunner);
    this.remoteInvoker = requireNonNull(remoteInvoker);
    this.backoff = requireNonNull(backoff);
    this.clock = requireNonNull(clock);
    this.eventSink = requireNonNull(eventSink);
    this.runsSucceeded = statsProvider.makeCounter(RUNS_SUCCEEDED);
    this.runsFailed = statsProvider.makeCounter(RUNS_FAILED);
    this.runAttempts = statsProvider.makeCounter(RUN_ATTEMPTS);
    this.persistenceErrors = statsProvider.makeCounter(RUN_PERSISTENCE_ERRORS);
  }

  @Override
  public void run(Firing firing) {
    Job job = firing.getJob();
    JobStat run = JobStat.started(job.getId(), clock.nowInstant(), firing.isManual());
    LOG.info("Starting run {} of job {} ({})", run.getId(), job.getId(), job.getName());
    saveQuietly(run, true);

    run = attempt(job, run);
    saveQuietly(run, false);
    if (run.getErrorDetail().isPresent()) {
      LOG.warn("Run {} of job {} failed after {} attempts: {}",
          run.getId(), job.getId(), run.getAttempts(), run.getErrorDetail().get());
    } else {
      LOG.info("Run {} of job {} succeeded after {} attempts",
          run.getId(), job.getId(), run.getAttempts());
    }

    boolean retired = scheduleNext(firing, run);
    eventSink.post(new RunFinished(run, retired));
  }

  private JobStat attempt(Job job, JobStat started) {
    JobStat run = started;
    long backoffMs = 0;
    while (true) {
      runAttempts.incrementAndGet();
      try {
        execute(job);
        runsSucceeded.incrementAndGet();
        return run.succeeded(finishTime(run));
      } catch (JobExecutionException e) {
        if (run.getRetries() >= job.getRetries()) {
          runsFailed.incrementAndGet();
          return run.failed(finishTime(run), e.getMessage());
        }
        backoffMs = backoff.calculateBackoffMs(backoffMs);
        LOG.info("Attempt {} of run {} failed, retrying in {} ms: {}",
            run.getAttempts(), run.getId(), backoffMs, e.getMessage());
        try {
          clock.waitFor(backoffMs);
        } catch (InterruptedException ie) {
          Thread.currentThread().interrupt();
          runsFailed.incrementAndGet();
          return run.failed(finishTime(run), "Interrupted before retry: " + e.getMessage());
        }
        run = run.retrying(e.getMessage());
        saveQuietly(run, false);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        runsFailed.incrementAndGet();
        return run.failed(finishTime(run), "Interrupted while executing");
      }
    }
  }

  private void execute(Job job) throws JobExecutionException, InterruptedException {
    switch (job.getType()) {
      case LOCAL:
        commandRunner.execute(job.getCommand());
        break;
      case REMOTE:
        remoteInvoker.invoke(job.getRemoteProperties().get());
        break;
      default:
        throw new IllegalStateException("Unknown job type " + job.getType());
    }
  }

  private boolean scheduleNext(Firing firing, JobStat run) {
    Job job = firing.getJob();
    if (firing.isManual()) {
      return firing.complete(run, job.getRemainingRepeats(), job.getNextRunAt());
    }

    Optional<Schedule> schedule;
    try {
      schedule = job.getParsedSchedule();
    } catch (MalformedScheduleException e) {
      LOG.error("Job {} has a malformed schedule, retiring it: {}", job.getId(), e.getMessage());
      schedule = Optional.empty();
    }

    long remaining = job.getRemainingRepeats();
    Optional<Instant> next;
    try {
      next = schedule.flatMap(s -> RecurrenceEngine.nextDue(
          s,
          firing.getDueAt(),
          clock.nowInstant(),
          remaining));
    } catch (RuntimeException e) {
      LOG.error("Failed to compute next run of job " + job.getId() + ", retiring it: " + e, e);
      next = Optional.empty();
    }
    long left = remaining > 0 ? remaining - 1 : remaining;
    return firing.complete(run, left, next);
  }

  // Keeps the finish time ordered after the start time if the clock steps backwards.
  private Instant finishTime(JobStat run) {
    Instant now = clock.nowInstant();
    return now.isBefore(run.getStartedAt()) ? run.getStartedAt() : now;
  }

  private void saveQuietly(JobStat run, boolean create) {
    try {
      if (create) {
        runStore.saveRun(run);
      } else {
        runStore.updateRun(run);
      }
    } catch (PersistenceException e) {
      persistenceErrors.incrementAndGet();
      LOG.error("Failed to persist run " + run.getId() + " of job " + run.getJobId() + ": " + e, e);
    }
  }
}
