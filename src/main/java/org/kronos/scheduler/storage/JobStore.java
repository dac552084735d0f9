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

import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.job.Job;

/**
 * Point of storage for job definitions.  Every method may throw {@link PersistenceException}.
 */
public interface JobStore {

  /**
   * Fetches all stored jobs, including retired ones.
   *
   * @return A snapshot of every stored job.
   */
  List<Job> getAll();

  /**
   * Fetches a single job.
   *
   * @param id Id of the job.
   * @return The stored job.
   * @throws JobNotFoundException If no job is stored under {@code id}.
   */
  Job get(String id) throws JobNotFoundException;

  /**
   * Creates or replaces a job.
   *
   * @param job Job to save.
   */
  void save(Job job);

  /**
   * Removes a job definition.  Runs of the job are not affected.
   *
   * @param id Id of the job to remove.
   * @throws JobNotFoundException If no job is stored under {@code id}.
   */
  void delete(String id) throws JobNotFoundException;

  /**
   * Releases resources held by the store.
   */
  void close();
}
