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
package org.kronos.scheduler.storage;

import java.util.List;
import java.util.Optional;

import org.kronos.scheduler.job.JobStat;

/**
 * Point of storage for run records.  Every method may throw {@link PersistenceException}.
 */
public interface RunStore {

  /**
   * Records a new run.
   *
   * @param run Run to save.
   */
  void saveRun(JobStat run);

  /**
   * Replaces the stored state of a run, creating it if necessary.
   *
   * @param run Updated run.
   */
  void updateRun(JobStat run);

  Optional<JobStat> getRun(String runId);

  /**
   * Fetches the runs of a job.
   *
   * @param jobId Job to fetch runs for.
   * @return Runs ordered by start time.
   */
  List<JobStat> getAllRuns(String jobId);

  /**
   * Deletes every run of a job.
   *
   * @param jobId Job whose runs are removed.
   */
  void deleteRuns(String jobId);

  /**
   * Deletes finished runs that fell out of the store's retention window.
   *
   * @return Number of runs deleted.
   */
  int clearExpiredRuns();
}
