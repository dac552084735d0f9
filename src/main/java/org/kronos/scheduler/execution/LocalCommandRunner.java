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

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.io.CharStreams;

import org.kronos.scheduler.base.CommandUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs local commands as subprocesses, without a shell.
 */
class LocalCommandRunner implements CommandRunner {
  private static final Logger LOG = LoggerFactory.getLogger(LocalCommandRunner.class);

  @VisibleForTesting
  static final int MAX_OUTPUT_DETAIL = 1024;

  @Override
  public void execute(String command) throws JobExecutionException, InterruptedException {
    List<String> args;
    try {
      args = CommandUtil.split(command);
    } catch (IllegalArgumentException e) {
      throw new JobExecutionException("Invalid command '" + command + "': " + e.getMessage(), e);
    }

    Process process;
    try {
      process = new ProcessBuilder(args).redirectErrorStream(true).start();
    } catch (IOException e) {
      throw new JobExecutionException("Failed to start '" + command + "': " + e.getMessage(), e);
    }

    String output;
    try (Reader reader =
             new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8)) {
      output = CharStreams.toString(reader);
    } catch (IOException e) {
      process.destroy();
      throw new JobExecutionException("Failed to read output of '" + command + "'", e);
    }

    int exitCode = process.waitFor();
    LOG.debug("Command '{}' exited with {}, output: {}", command, exitCode, output);
    if (exitCode != 0) {
      throw new JobExecutionException(
          "Command '" + command + "' exited with status " + exitCode + tail(output));
    }
  }

  private static String tail(String output) {
    String trimmed = output.trim();
    if (trimmed.isEmpty()) {
      return "";
    }
    if (trimmed.length() > MAX_OUTPUT_DETAIL) {
      trimmed = trimmed.substring(trimmed.length() - MAX_OUTPUT_DETAIL);
    }
    return ": " + trimmed;
  }
}
