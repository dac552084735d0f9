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

/**
 * Executes the runs of due jobs.
 */
public interface JobRunner {

  /**
   * Executes one run.  Called on a worker thread while no other run of the same job executes.
   * Implementations must report the outcome through {@link Firing#complete}.
   *
   * @param firing The firing to execute.
   */
  void run(Firing firing);
}
