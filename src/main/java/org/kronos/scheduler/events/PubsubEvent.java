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

import java.util.Objects;

import com.google.common.base.MoreObjects;

import org.kronos.scheduler.job.JobStat;

import static java.util.Objects.requireNonNull;

/**
 * Event notifications related to job runs.
 */
public interface PubsubEvent {

  /**
   * Interface with no functionality, but identifies a class as supporting run pubsub events.
   */
  interface EventSubscriber {
  }

  /**
   * Event sent once per run, after the run reached a terminal state and the job was
   * rescheduled or retired.
   */
  class RunFinished implements PubsubEvent {
    private final JobStat run;
    private final boolean retired;

    public RunFinished(JobStat run, boolean retired) {
      this.run = requireNonNull(run);
      this.retired = retired;
    }

    public JobStat getRun() {
      return run;
    }

    public String getJobId() {
      return run.getJobId();
    }

    /**
     * Whether the job was retired from the cache because no occurrences remain.
     *
     * @return {@code true} if the job has no further runs scheduled.
     */
    public boolean isRetired() {
      return retired;
    }

    @Override
    public boolean equals(Object o) {
      if (!(o instanceof RunFinished)) {
        return false;
      }
      RunFinished other = (RunFinished) o;
      return retired == other.retired && run.equals(other.run);
    }

    @Override
    public int hashCode() {
      return Objects.hash(run, retired);
    }

    @Override
    public String toString() {
      return MoreObjects.toStringHelper(this)
          .add("run", run)
          .add("retired", retired)
          .toString();
    }
  }
}
