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

import com.google.common.collect.ImmutableSet;

import org.junit.Before;
import org.junit.Test;
import org.kronos.common.stats.StatsRegistry;
import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.job.JobType;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class MemJobStoreTest {

  private static final Job JOB_A = makeJob("a");
  private static final Job JOB_B = makeJob("b");

  private StatsRegistry stats;
  private MemJobStore store;

  @Before
  public void setUp() {
    stats = new StatsRegistry();
    store = new MemJobStore(stats);
  }

  private static Job makeJob(String id) {
    return Job.newBuilder().setId(id).setType(JobType.LOCAL).setCommand("echo " + id).build();
  }

  private void expectStoreSize(long size) {
    assertEquals(size, stats.getLongValue(MemJobStore.JOBS_SIZE));
    assertEquals(size, store.getAll().size());
  }

  @Test
  public void testJobStore() throws Exception {
    expectStoreSize(0);

    store.save(JOB_A);
    store.save(JOB_B);
    expectStoreSize(2);
    assertEquals(ImmutableSet.of(JOB_A, JOB_B), ImmutableSet.copyOf(store.getAll()));
    assertEquals(JOB_A, store.get("a"));

    store.delete("a");
    expectStoreSize(1);
    assertEquals(ImmutableSet.of(JOB_B), ImmutableSet.copyOf(store.getAll()));
  }

  @Test
  public void testUpdate() throws Exception {
    store.save(JOB_A);
    Job disabled = JOB_A.toBuilder().setDisabled(true).build();
    store.save(disabled);
    expectStoreSize(1);
    assertEquals(disabled, store.get("a"));
  }

  @Test
  public void testMissingJob() {
    try {
      store.get("missing");
      fail("Expected JobNotFoundException");
    } catch (JobNotFoundException e) {
      assertEquals("missing", e.getJobId());
    }
  }

  @Test(expected = JobNotFoundException.class)
  public void testDeleteMissingJob() throws Exception {
    store.delete("missing");
  }
}
