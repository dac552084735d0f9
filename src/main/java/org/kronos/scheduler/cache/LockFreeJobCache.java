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
package org.kronos.scheduler.cache;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;

import javax.inject.Inject;
import javax.inject.Provider;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.kronos.common.stats.StatsProvider;
import org.kronos.common.util.Clock;
import org.kronos.scheduler.async.AsyncModule.TimerExecutor;
import org.kronos.scheduler.async.AsyncModule.WorkerExecutor;
import org.kronos.scheduler.base.DuplicateJobException;
import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.base.SchedulerException;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.job.JobStat;
import org.kronos.scheduler.schedule.MalformedScheduleException;
import org.kronos.scheduler.schedule.RecurrenceEngine;
import org.kronos.scheduler.schedule.Schedule;
import org.kronos.scheduler.storage.JobStore;
import org.kronos.scheduler.storage.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * A job cache backed by a concurrent map of per-job entries.
 *
 * <p>Each entry holds a volatile job snapshot, so reads take no lock.  Changes to an entry's
 * snapshot and timer are made under that entry's monitor.  Every arming of a timer starts a new
 * generation; a timer that fires for an older generation does nothing.  Runs of one job are
 * serialized by the entry's execution lock, and a firing that acquires the lock after its
 * generation was superseded is dropped.
 */
public class LockFreeJobCache implements JobCache {
  private static final Logger LOG = LoggerFactory.getLogger(LockFreeJobCache.class);

  @VisibleForTesting
  static final String JOBS_ADDED = "jobs_added";
  @VisibleForTesting
  static final String JOBS_RETIRED = "jobs_retired";
  @VisibleForTesting
  static final String TRIGGERS_COALESCED = "job_triggers_coalesced";
  @VisibleForTesting
  static final String JOB_PERSISTENCE_ERRORS = "job_persistence_errors";
  @VisibleForTesting
  static final String JOBS_CACHED = "jobs_cached";

  private final ConcurrentMap<String, Entry> entries = Maps.newConcurrentMap();
  private final JobStore jobStore;
  private final Clock clock;
  private final ScheduledExecutorService timers;
  private final ExecutorService workers;
  private final Provider<JobRunner> runner;
  private final AtomicLong jobsAdded;
  private final AtomicLong jobsRetired;
  private final AtomicLong triggersCoalesced;
  private final AtomicLong persistenceErrors;
  private volatile boolean stopped;

  @Inject
  LockFreeJobCache(
      JobStore jobStore,
      Clock clock,
      @TimerExecutor ScheduledExecutorService timers,
      @WorkerExecutor ExecutorService workers,
      Provider<JobRunner> runner,
      StatsProvider statsProvider) {

    this.jobStore = requireNonNull(jobStore);
    this.clock = requireNonNull(clock);
    this.timers = requireNonNull(timers);
    this.workers = requireNonNull(workers);
    this.runner = requireNonNull(runner);
    this.jobsAdded = statsProvider.makeCounter(JOBS_ADDED);
    this.jobsRetired = statsProvider.makeCounter(JOBS_RETIRED);
    this.triggersCoalesced = statsProvider.makeCounter(TRIGGERS_COALESCED);
    this.persistenceErrors = statsProvider.makeCounter(JOB_PERSISTENCE_ERRORS);
    statsProvider.makeGauge(JOBS_CACHED, entries::size);
  }

  private final class Entry {
    private final ReentrantLock executionLock = new ReentrantLock();
    private volatile Job job;
    private volatile boolean removed;

    // Guarded by the entry monitor.
    private ScheduledFuture<?> timer;
    private long generation;
    private long consumedGeneration;

    Entry(Job job) {
      this.job = job;
    }
  }

  @Override
  public Job add(Job job) throws MalformedScheduleException, DuplicateJobException {
    requireNonNull(job);
    checkArgument(!job.isDone(), "Job %s is already done", job.getId());

    Optional<Schedule> schedule = job.getParsedSchedule();
    Instant now = clock.nowInstant();
    Instant due = RecurrenceEngine.firstDue(schedule, now);
    Job snapshot = job.toBuilder()
        .setCreatedAt(job.getCreatedAt().orElse(now))
        .setNextRunAt(due)
        .build();

    Entry entry = new Entry(snapshot);
    if (entries.putIfAbsent(snapshot.getId(), entry) != null) {
      throw new DuplicateJobException(snapshot.getId());
    }
    synchronized (entry) {
      try {
        jobStore.save(snapshot);
      } catch (PersistenceException e) {
        entry.removed = true;
        entries.remove(snapshot.getId(), entry);
        throw e;
      }
      if (!snapshot.isDisabled()) {
        arm(entry, due);
      }
    }

    jobsAdded.incrementAndGet();
    LOG.info("Added job {} ({}), first run due at {}", snapshot.getId(), snapshot.getName(), due);
    return snapshot;
  }

  @Override
  public Optional<Job> get(String id) {
    Entry entry = entries.get(requireNonNull(id));
    return entry == null ? Optional.empty() : Optional.of(entry.job);
  }

  @Override
  public List<Job> getAll() {
    return entries.values().stream()
        .map(entry -> entry.job)
        .collect(ImmutableList.toImmutableList());
  }

  private Entry fetch(String id) throws JobNotFoundException {
    Entry entry = entries.get(requireNonNull(id));
    if (entry == null || entry.removed) {
      throw new JobNotFoundException(id);
    }
    return entry;
  }

  @Override
  public void delete(String id) throws JobNotFoundException {
    Entry entry = fetch(id);
    synchronized (entry) {
      if (entry.removed) {
        throw new JobNotFoundException(id);
      }
      try {
        jobStore.delete(id);
      } catch (JobNotFoundException e) {
        LOG.warn("Job {} was cached but not stored", id);
      }
      entry.removed = true;
      disarm(entry);
      entries.remove(id, entry);
    }
    LOG.info("Deleted job {}", id);
  }

  @Override
  public void reschedule(String id, Optional<Instant> next) throws JobNotFoundException {
    requireNonNull(next);
    Entry entry = fetch(id);
    synchronized (entry) {
      if (entry.removed) {
        throw new JobNotFoundException(id);
      }
      if (!applyNext(entry, entry.job, next)) {
        persistQuietly(entry.job);
      }
    }
  }

  @Override
  public Job disable(String id) throws JobNotFoundException {
    Entry entry = fetch(id);
    synchronized (entry) {
      if (entry.removed) {
        throw new JobNotFoundException(id);
      }
      if (entry.job.isDisabled()) {
        return entry.job;
      }
      Job updated = entry.job.toBuilder().setDisabled(true).build();
      jobStore.save(updated);
      entry.job = updated;
      disarm(entry);
      LOG.info("Disabled job {}", id);
      return updated;
    }
  }

  @Override
  public Job enable(String id) throws JobNotFoundException {
    Entry entry = fetch(id);
    synchronized (entry) {
      if (entry.removed) {
        throw new JobNotFoundException(id);
      }
      if (!entry.job.isDisabled()) {
        return entry.job;
      }
      Instant due = resumeDue(entry.job, clock.nowInstant());
      Job updated = entry.job.toBuilder().setDisabled(false).setNextRunAt(due).build();
      jobStore.save(updated);
      entry.job = updated;
      arm(entry, due);
      LOG.info("Enabled job {}, next run due at {}", id, due);
      return updated;
    }
  }

  @Override
  public void trigger(String id) throws JobNotFoundException {
    Entry entry = fetch(id);
    Instant now = clock.nowInstant();
    LOG.info("Triggering manual run of job {}", id);
    workers.execute(() -> execute(entry, 0, now, true));
  }

  @Override
  public void start() {
    stopped = false;
    Instant now = clock.nowInstant();
    int loaded = 0;
    for (Job job : jobStore.getAll()) {
      if (job.isDone()) {
        continue;
      }
      Instant due;
      try {
        due = resumeDue(job, now);
      } catch (SchedulerException e) {
        LOG.error("Not loading job {}: {}", job.getId(), e.getMessage());
        continue;
      }
      Entry entry = new Entry(job.toBuilder()
          .setCreatedAt(job.getCreatedAt().orElse(now))
          .setNextRunAt(due)
          .build());
      if (entries.putIfAbsent(job.getId(), entry) != null) {
        LOG.warn("Job {} is already cached, ignoring stored copy", job.getId());
        continue;
      }
      synchronized (entry) {
        if (!job.isDisabled()) {
          arm(entry, due);
        }
      }
      loaded++;
    }
    LOG.info("Loaded {} jobs", loaded);
  }

  @Override
  public void stop() {
    stopped = true;
    for (Entry entry : entries.values()) {
      synchronized (entry) {
        disarm(entry);
      }
    }
    persistAll();
    LOG.info("Job cache stopped");
  }

  @Override
  public void persistAll() {
    int saved = 0;
    for (Entry entry : entries.values()) {
      // A removed entry must never be written back.
      synchronized (entry) {
        if (!entry.removed && persistQuietly(entry.job)) {
          saved++;
        }
      }
    }
    LOG.debug("Persisted {} jobs", saved);
  }

  private boolean persistQuietly(Job job) {
    try {
      jobStore.save(job);
      return true;
    } catch (PersistenceException e) {
      persistenceErrors.incrementAndGet();
      LOG.error("Failed to persist job " + job.getId() + ": " + e, e);
      return false;
    }
  }

  private Instant resumeDue(Job job, Instant now) {
    Optional<Schedule> schedule;
    try {
      schedule = job.getParsedSchedule();
    } catch (MalformedScheduleException e) {
      throw new SchedulerException("Job " + job.getId() + " has a malformed schedule", e);
    }

    Optional<Instant> stored = job.getNextRunAt();
    if (!stored.isPresent()) {
      return RecurrenceEngine.firstDue(schedule, now);
    }
    if (stored.get().isAfter(now)) {
      return stored.get();
    }
    if (job.isResumeAtNextScheduledTime() && schedule.isPresent()) {
      return RecurrenceEngine.nextDue(schedule.get(), stored.get(), now, job.getRemainingRepeats())
          .orElse(now);
    }
    // Missed occurrences collapse into one run as soon as possible.
    return now;
  }

  // Caller must hold the entry monitor.  Returns true if the job was retired.
  private boolean applyNext(Entry entry, Job base, Optional<Instant> next) {
    if (next.isPresent()) {
      Job updated = base.toBuilder().setNextRunAt(next.get()).build();
      entry.job = updated;
      if (updated.isDisabled()) {
        disarm(entry);
      } else {
        arm(entry, next.get());
      }
      return false;
    }

    Job done = base.toBuilder().setDone(true).build();
    entry.job = done;
    entry.removed = true;
    disarm(entry);
    entries.remove(done.getId(), entry);
    persistQuietly(done);
    jobsRetired.incrementAndGet();
    LOG.info("Job {} has no occurrences left, retired", done.getId());
    return true;
  }

  // Caller must hold the entry monitor.
  private void arm(Entry entry, Instant due) {
    disarm(entry);
    if (stopped) {
      return;
    }
    long generation = entry.generation;
    long delayMs = Math.max(0, Duration.between(clock.nowInstant(), due).toMillis());
    entry.timer = timers.schedule(
        () -> fire(entry, generation),
        delayMs,
        TimeUnit.MILLISECONDS);
  }

  // Caller must hold the entry monitor.
  private void disarm(Entry entry) {
    entry.generation++;
    if (entry.timer != null) {
      entry.timer.cancel(false);
      entry.timer = null;
    }
  }

  private void fire(Entry entry, long generation) {
    Instant due;
    synchronized (entry) {
      if (entry.removed || entry.generation != generation) {
        return;
      }
      entry.timer = null;
      due = entry.job.getNextRunAt().orElseGet(clock::nowInstant);
    }
    workers.execute(() -> execute(entry, generation, due, false));
  }

  private void execute(Entry entry, long generation, Instant due, boolean manual) {
    entry.executionLock.lock();
    try {
      Job job;
      synchronized (entry) {
        if (entry.removed) {
          LOG.info("Job {} was removed before it could run", entry.job.getId());
          return;
        }
        if (!manual) {
          if (entry.generation != generation || entry.consumedGeneration >= generation) {
            triggersCoalesced.incrementAndGet();
            LOG.info("Dropping superseded firing of job {} due at {}", entry.job.getId(), due);
            return;
          }
          entry.consumedGeneration = generation;
        }
        job = entry.job;
      }
      runner.get().run(new EntryFiring(entry, job, due, manual));
    } finally {
      entry.executionLock.unlock();
    }
  }

  private final class EntryFiring implements Firing {
    private final Entry entry;
    private final Job job;
    private final Instant dueAt;
    private final boolean manual;

    EntryFiring(Entry entry, Job job, Instant dueAt, boolean manual) {
      this.entry = entry;
      this.job = job;
      this.dueAt = dueAt;
      this.manual = manual;
    }

    @Override
    public Job getJob() {
      return job;
    }

    @Override
    public Instant getDueAt() {
      return dueAt;
    }

    @Override
    public boolean isManual() {
      return manual;
    }

    @Override
    public boolean complete(JobStat run, long remainingRepeats, Optional<Instant> next) {
      requireNonNull(run);
      requireNonNull(next);
      synchronized (entry) {
        if (entry.removed) {
          LOG.info("Job {} was removed while running, not rescheduling", job.getId());
          return true;
        }
        Job current = entry.job;
        Job.Builder updated = current.toBuilder()
            .setMetadata(current.getMetadata().recordRun(run));
        if (manual) {
          entry.job = updated.build();
          persistQuietly(entry.job);
          return false;
        }
        updated.setRemainingRepeats(remainingRepeats);
        if (applyNext(entry, updated.build(), next)) {
          return true;
        }
        persistQuietly(entry.job);
        return false;
      }
    }
  }
}
