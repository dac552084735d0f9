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

import org.kronos.scheduler.job.RemoteProperties;

/**
 * Performs the call of a remote job.
 */
public interface RemoteInvoker {

  /**
   * Invokes a remote endpoint and waits for its response.
   *
   * @param properties Description of the call.
   * @throws JobExecutionException If the call failed or returned an unexpected status.
   * @throws InterruptedException If interrupted while waiting for the response.
   */
  void invoke(RemoteProperties properties) throws JobExecutionException, InterruptedException;
}
