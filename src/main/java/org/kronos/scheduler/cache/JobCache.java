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

import java.time.Instant;
import java.util.List;
import java.util.Optional;

import org.kronos.scheduler.base.DuplicateJobException;
import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.schedule.MalformedScheduleException;
import org.kronos.scheduler.storage.PersistenceException;

/**
 * The authoritative index of active jobs and their armed timers.  Reads never block; mutations
 * of one job never block mutations of another.
 */
public interface JobCache {

  /**
   * Adds a job, persists it and arms its first run.
   *
   * @param job Job to add.
   * @return The cached snapshot, with its first due instant set.
   * @throws MalformedScheduleException If the job's schedule does not parse.
   * @throws DuplicateJobException If a job with the same id is already cached.
   * @throws PersistenceException If the job could not be saved, in which case it is not added.
   */
  Job add(Job job) throws MalformedScheduleException, DuplicateJobException;

  Optional<Job> get(String id);

  /**
   * Fetches a snapshot of every cached job, in no particular order.
   *
   * @return Cached jobs.
   */
  List<Job> getAll();

  /**
   * Disarms and removes a job, and deletes its definition from the job store.  Its runs are kept.
   * A run that is already executing completes, but the job is not scheduled again.
   *
   * @param id Job to delete.
   * @throws JobNotFoundException If the job is not cached.
   */
  void delete(String id) throws JobNotFoundException;

  /**
   * Re-arms a job at a new due instant, or retires it.
   *
   * @param id Job to reschedule.
   * @param next The new due instant, or empty to retire the job because no occurrences remain.
   * @throws JobNotFoundException If the job is not cached.
   */
  void reschedule(String id, Optional<Instant> next) throws JobNotFoundException;

  /**
   * Disarms a job without removing it.
   *
   * @param id Job to disable.
   * @return The updated snapshot.
   * @throws JobNotFoundException If the job is not cached.
   */
  Job disable(String id) throws JobNotFoundException;

  /**
   * Re-arms a disabled job at its next due instant, computed from the current time.
   *
   * @param id Job to enable.
   * @return The updated snapshot.
   * @throws JobNotFoundException If the job is not cached.
   */
  Job enable(String id) throws JobNotFoundException;

  /**
   * Runs a job now, outside its schedule.  The run does not consume a repetition and does not
   * move the job's next due instant.
   *
   * @param id Job to run.
   * @throws JobNotFoundException If the job is not cached.
   */
  void trigger(String id) throws JobNotFoundException;

  /**
   * Loads every job that is not done from the job store and arms it.
   */
  void start();

  /**
   * Disarms every job and persists the cached snapshots.
   */
  void stop();

  /**
   * Saves every cached snapshot to the job store.
   */
  void persistAll();
}
