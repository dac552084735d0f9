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
package org.kronos.scheduler.execution;

/**
 * Executes the command of a local job.
 */
public interface CommandRunner {

  /**
   * Runs a command to completion.
   *
   * @param command Command line to run.
   * @throws JobExecutionException If the command could not be started or exited unsuccessfully.
   * @throws InterruptedException If interrupted while waiting for the command.
   */
  void execute(String command) throws JobExecutionException, InterruptedException;
}
