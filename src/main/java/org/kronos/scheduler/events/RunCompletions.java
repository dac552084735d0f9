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
package org.kronos.scheduler.events;

import java.util.Collection;

import javax.inject.Singleton;

import com.google.common.collect.HashMultimap;
import com.google.common.collect.SetMultimap;
import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.SettableFuture;

import org.kronos.scheduler.events.PubsubEvent.EventSubscriber;
import org.kronos.scheduler.events.PubsubEvent.RunFinished;
import org.kronos.scheduler.job.JobStat;

import static java.util.Objects.requireNonNull;

/**
 * Hands out futures that complete when a job's next run finishes.
 */
@Singleton
public class RunCompletions implements EventSubscriber {
  private final SetMultimap<String, SettableFuture<JobStat>> waiters = HashMultimap.create();

  /**
   * Returns a future for the next run of a job to finish after this call.
   *
   * @param jobId Job to wait on.
   * @return A future that is set once, with the finished run.
   */
  public ListenableFuture<JobStat> awaitNextRun(String jobId) {
    requireNonNull(jobId);
    SettableFuture<JobStat> future = SettableFuture.create();
    synchronized (waiters) {
      waiters.put(jobId, future);
    }
    return future;
  }

  @Subscribe
  public void runFinished(RunFinished event) {
    Collection<SettableFuture<JobStat>> completed;
    synchronized (waiters) {
      completed = waiters.removeAll(event.getJobId());
    }
    completed.forEach(future -> future.set(event.getRun()));
  }
}
