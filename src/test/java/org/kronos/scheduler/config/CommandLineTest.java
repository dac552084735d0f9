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
package org.kronos.scheduler.config;

import java.io.File;
import java.time.Duration;

import com.beust.jcommander.ParameterException;

import org.junit.Test;
import org.kronos.scheduler.config.types.TimeAmount;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;

public class CommandLineTest {

  @Test
  public void testDefaults() {
    CliOptions options = CommandLine.parseOptions();
    assertNull(options.main.jobsFile);
    assertEquals(2, options.async.timerThreads);
    assertEquals(16, options.async.jobWorkerThreads);
    assertEquals(Duration.ofDays(7), options.storage.runRetention.asDuration());
    assertEquals(Duration.ofMinutes(1), options.cache.persistInterval.asDuration());
    assertEquals(Duration.ofSeconds(1), options.execution.retryInitialBackoff.asDuration());
    assertEquals(Duration.ofMinutes(15), options.pruning.runPruneInterval.asDuration());
  }

  @Test
  public void testParse() {
    CliOptions options = CommandLine.parseOptions(
        "-jobs_file=/etc/kronos/jobs.json",
        "-timer_threads=4",
        "-job_worker_threads=32",
        "-run_retention=2days",
        "-persist_interval=30secs",
        "-retry_initial_backoff=500ms",
        "-retry_max_backoff=2mins",
        "-remote_connect_timeout=3secs",
        "-run_prune_interval=1hrs",
        "-shutdown_timeout=10secs");

    assertEquals(new File("/etc/kronos/jobs.json"), options.main.jobsFile);
    assertEquals(new TimeAmount(10, TimeAmount.Unit.SECONDS), options.main.shutdownTimeout);
    assertEquals(4, options.async.timerThreads);
    assertEquals(32, options.async.jobWorkerThreads);
    assertEquals(Duration.ofDays(2), options.storage.runRetention.asDuration());
    assertEquals(Duration.ofSeconds(30), options.cache.persistInterval.asDuration());
    assertEquals(Duration.ofMillis(500), options.execution.retryInitialBackoff.asDuration());
    assertEquals(Duration.ofMinutes(2), options.execution.retryMaxBackoff.asDuration());
    assertEquals(Duration.ofSeconds(3), options.execution.remoteConnectTimeout.asDuration());
    assertEquals(Duration.ofHours(1), options.pruning.runPruneInterval.asDuration());
  }

  @Test(expected = ParameterException.class)
  public void testNonPositiveThreads() {
    CommandLine.parseOptions("-job_worker_threads=0");
  }

  @Test(expected = ParameterException.class)
  public void testNonPositiveAmount() {
    CommandLine.parseOptions("-persist_interval=0secs");
  }

  @Test(expected = ParameterException.class)
  public void testUnknownOption() {
    CommandLine.parseOptions("-no_such_option=1");
  }

  @Test
  public void testEveryOptionsGroupRegistered() {
    assertEquals(
        CliOptions.class.getDeclaredFields().length,
        CommandLine.getOptionsObjects(new CliOptions()).size());
  }
}
