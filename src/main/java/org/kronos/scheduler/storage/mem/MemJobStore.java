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
package org.kronos.scheduler.storage.mem;

import java.util.List;
import java.util.Map;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.Maps;

import org.kronos.common.stats.StatsProvider;
import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.storage.JobStore;

import static java.util.Objects.requireNonNull;

/**
 * An in-memory job store.
 */
class MemJobStore implements JobStore {
  @VisibleForTesting
  static final String JOBS_SIZE = "mem_storage_jobs_size";

  private final Map<String, Job> jobs = Maps.newConcurrentMap();

  @Inject
  MemJobStore(StatsProvider statsProvider) {
    statsProvider.makeGauge(JOBS_SIZE, () -> jobs.size());
  }

  @Override
  public List<Job> getAll() {
    return ImmutableList.copyOf(jobs.values());
  }

  @Override
  public Job get(String id) throws JobNotFoundException {
    Job job = jobs.get(requireNonNull(id));
    if (job == null) {
      throw new JobNotFoundException(id);
    }
    return job;
  }

  @Override
  public void save(Job job) {
    jobs.put(job.getId(), job);
  }

  @Override
  public void delete(String id) throws JobNotFoundException {
    if (jobs.remove(requireNonNull(id)) == null) {
      throw new JobNotFoundException(id);
    }
  }

  @Override
  public void close() {
    // Nothing to release.
  }
}
