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
package org.kronos.scheduler.app;

import java.io.IOException;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.io.CharStreams;

import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.job.JobType;
import org.kronos.scheduler.job.RemoteProperties;
import org.kronos.scheduler.schedule.MalformedScheduleException;

/**
 * A utility class to read JSON-formatted job definitions used to seed the job store.
 */
public final class JobsFileLoader {

  private JobsFileLoader() {
    // Utility class
  }

  /**
   * Thrown when a jobs file could not be read.
   */
  public static class JobsFileException extends Exception {
    public JobsFileException(String message) {
      super(message);
    }

    public JobsFileException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * Reads job definitions from a JSON-encoded source holding a list of jobs.
   *
   * @param input The jobs data source.
   * @return The jobs, in file order.
   * @throws JobsFileException If the input cannot be read, is not properly formatted, or holds an
   *     invalid job.
   */
  public static List<Job> read(Readable input) throws JobsFileException {
    String contents;
    try {
      contents = CharStreams.toString(input);
    } catch (IOException e) {
      throw new JobsFileException("Failed to read jobs file", e);
    }

    ObjectMapper mapper = new ObjectMapper()
        .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
    List<Schema> parsed;
    try {
      parsed = mapper.readValue(contents, new TypeReference<List<Schema>>() { });
    } catch (IOException e) {
      throw new JobsFileException("Malformed jobs file: " + e.getMessage(), e);
    }

    ImmutableList.Builder<Job> jobs = ImmutableList.builder();
    for (Schema schema : parsed) {
      jobs.add(toJob(schema));
    }
    return jobs.build();
  }

  private static Job toJob(Schema schema) throws JobsFileException {
    // Seeded jobs need stable ids so that restarts do not add them again.
    if (Strings.isNullOrEmpty(schema.id)) {
      throw new JobsFileException("Seeded job '" + schema.name + "' has no id");
    }
    try {
      Job.Builder builder = Job.newBuilder()
          .setId(schema.id)
          .setName(schema.name)
          .setOwner(schema.owner)
          .setCommand(schema.command)
          .setSchedule(schema.schedule)
          .setRetries(schema.retries)
          .setDisabled(schema.disabled)
          .setResumeAtNextScheduledTime(schema.resumeAtNextScheduledTime);
      if (schema.remote == null) {
        builder.setType(JobType.LOCAL);
      } else {
        builder.setType(JobType.REMOTE).setRemoteProperties(toRemote(schema.remote));
      }
      Job job = builder.build();
      job.getParsedSchedule();
      return job;
    } catch (IllegalArgumentException | MalformedScheduleException e) {
      throw new JobsFileException("Invalid job " + schema.id + ": " + e.getMessage(), e);
    }
  }

  private static RemoteProperties toRemote(RemoteSchema remote) {
    RemoteProperties.Builder builder = RemoteProperties.newBuilder()
        .setUrl(remote.url)
        .setMethod(remote.method)
        .setBody(remote.body);
    if (remote.headers != null) {
      builder.setHeaders(remote.headers);
    }
    if (remote.timeout != null) {
      builder.setTimeoutMsec(remote.timeout);
    }
    if (remote.expectedResponseCodes != null) {
      remote.expectedResponseCodes.forEach(builder::addExpectedResponseCode);
    }
    return builder.build();
  }

  /**
   * The JSON schema of a job.  Jobs with a {@code remote} section are remote jobs, all others run
   * their {@code command} locally.
   */
  private static class Schema {
    private String id;
    private String name;
    private String owner;
    private String command;
    private String schedule;
    private int retries;
    private boolean disabled;
    private boolean resumeAtNextScheduledTime;
    private RemoteSchema remote;

    void setId(String id) {
      this.id = id;
    }

    void setName(String name) {
      this.name = name;
    }

    void setOwner(String owner) {
      this.owner = owner;
    }

    void setCommand(String command) {
      this.command = command;
    }

    void setSchedule(String schedule) {
      this.schedule = schedule;
    }

    void setRetries(int retries) {
      this.retries = retries;
    }

    void setDisabled(boolean disabled) {
      this.disabled = disabled;
    }

    void setResumeAtNextScheduledTime(boolean resumeAtNextScheduledTime) {
      this.resumeAtNextScheduledTime = resumeAtNextScheduledTime;
    }

    void setRemote(RemoteSchema remote) {
      this.remote = remote;
    }
  }

  private static class RemoteSchema {
    private String url;
    private String method;
    private Map<String, String> headers;
    private String body;
    private Integer timeout;
    private List<Integer> expectedResponseCodes;

    void setUrl(String url) {
      this.url = url;
    }

    void setMethod(String method) {
      this.method = method;
    }

    void setHeaders(Map<String, String> headers) {
      this.headers = headers;
    }

    void setBody(String body) {
      this.body = body;
    }

    void setTimeout(Integer timeout) {
      this.timeout = timeout;
    }

    void setExpectedResponseCodes(List<Integer> expectedResponseCodes) {
      this.expectedResponseCodes = expectedResponseCodes;
    }
  }
}
