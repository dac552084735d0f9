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
import java.util.Optional;

import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.job.JobStat;

/**
 * A single firing of a cached job, bound to the cache entry that armed it.
 */
public interface Firing {

  /**
   * Returns the job as it was when the firing started.
   *
   * @return Job snapshot.
   */
  Job getJob();

  /**
   * Returns the instant the firing was due, which is the trigger time for manual firings.
   *
   * @return Due instant.
   */
  Instant getDueAt();

  /**
   * Whether the firing was triggered outside the job's schedule.
   *
   * @return {@code true} for manual firings.
   */
  boolean isManual();

  /**
   * Records a finished run against the job and schedules what follows it.  Manual firings only
   * record the run.  Has no scheduling effect if the job was removed while running.
   *
   * @param run The finished run.
   * @param remainingRepeats Repetitions left after this firing.
   * @param next The next due instant, or empty to retire the job.
   * @return {@code true} if the job will not run again on its schedule.
   */
  boolean complete(JobStat run, long remainingRepeats, Optional<Instant> next);
}
