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
package org.kronos.scheduler.job;

import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;

import com.google.common.base.MoreObjects;
import com.google.common.base.Strings;

import org.kronos.scheduler.schedule.MalformedScheduleException;
import org.kronos.scheduler.schedule.Schedule;

import static java.util.Objects.requireNonNull;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * An immutable snapshot of a job definition and its bookkeeping.  Changes are made by deriving a
 * new snapshot through {@link #toBuilder()}.
 */
public final class Job {
  private final String id;
  private final String name;
  private final String owner;
  private final JobType type;
  private final String command;
  private final Optional<RemoteProperties> remoteProperties;
  private final String schedule;
  private final int retries;
  private final long remainingRepeats;
  private final boolean disabled;
  private final boolean done;
  private final boolean resumeAtNextScheduledTime;
  private final Optional<Instant> createdAt;
  private final Optional<Instant> nextRunAt;
  private final JobMetadata metadata;

  private Job(Builder builder) {
    this.id = builder.id;
    this.name = builder.name;
    this.owner = builder.owner;
    this.type = builder.type;
    this.command = builder.command;
    this.remoteProperties = Optional.ofNullable(builder.remoteProperties);
    this.schedule = builder.schedule;
    this.retries = builder.retries;
    this.remainingRepeats = builder.remainingRepeats;
    this.disabled = builder.disabled;
    this.done = builder.done;
    this.resumeAtNextScheduledTime = builder.resumeAtNextScheduledTime;
    this.createdAt = Optional.ofNullable(builder.createdAt);
    this.nextRunAt = Optional.ofNullable(builder.nextRunAt);
    this.metadata = builder.metadata;
  }

  public static Builder newBuilder() {
    return new Builder();
  }

  /**
   * Creates a builder initialized with every field of this job.
   *
   * @return A builder for a modified copy of this job.
   */
  public Builder toBuilder() {
    Builder builder = new Builder();
    builder.id = id;
    builder.name = name;
    builder.owner = owner;
    builder.type = type;
    builder.command = command;
    builder.remoteProperties = remoteProperties.orElse(null);
    builder.schedule = schedule;
    builder.retries = retries;
    builder.remainingRepeats = remainingRepeats;
    builder.disabled = disabled;
    builder.done = done;
    builder.resumeAtNextScheduledTime = resumeAtNextScheduledTime;
    builder.createdAt = createdAt.orElse(null);
    builder.nextRunAt = nextRunAt.orElse(null);
    builder.metadata = metadata;
    return builder;
  }

  public String getId() {
    return id;
  }

  public String getName() {
    return name;
  }

  public String getOwner() {
    return owner;
  }

  public JobType getType() {
    return type;
  }

  /**
   * Returns the command line of a {@link JobType#LOCAL local} job.
   *
   * @return The command, empty for remote jobs.
   */
  public String getCommand() {
    return command;
  }

  public Optional<RemoteProperties> getRemoteProperties() {
    return remoteProperties;
  }

  /**
   * Returns the schedule specification.  An empty specification means the job runs once, as
   * soon as it is added.
   *
   * @return The unparsed schedule.
   */
  public String getSchedule() {
    return schedule;
  }

  /**
   * Parses the schedule of this job.
   *
   * @return The schedule, or empty if the job has none.
   * @throws MalformedScheduleException If the schedule specification is malformed.
   */
  public Optional<Schedule> getParsedSchedule() throws MalformedScheduleException {
    return schedule.isEmpty() ? Optional.empty() : Optional.of(Schedule.parse(schedule));
  }

  public int getRetries() {
    return retries;
  }

  /**
   * Returns the number of scheduled firings left after the next one, or
   * {@link Schedule#INDEFINITE}.
   *
   * @return Remaining repetitions.
   */
  public long getRemainingRepeats() {
    return remainingRepeats;
  }

  public boolean isDisabled() {
    return disabled;
  }

  public boolean isDone() {
    return done;
  }

  public boolean isResumeAtNextScheduledTime() {
    return resumeAtNextScheduledTime;
  }

  /**
   * Returns when the job was first added to the scheduler.
   *
   * @return Creation time, absent until the job has been added.
   */
  public Optional<Instant> getCreatedAt() {
    return createdAt;
  }

  public Optional<Instant> getNextRunAt() {
    return nextRunAt;
  }

  public JobMetadata getMetadata() {
    return metadata;
  }

  @Override
  public boolean equals(Object o) {
    if (!(o instanceof Job)) {
      return false;
    }
    Job other = (Job) o;
    return retries == other.retries
        && remainingRepeats == other.remainingRepeats
        && disabled == other.disabled
        && done == other.done
        && resumeAtNextScheduledTime == other.resumeAtNextScheduledTime
        && id.equals(other.id)
        && name.equals(other.name)
        && owner.equals(other.owner)
        && type == other.type
        && command.equals(other.command)
        && remoteProperties.equals(other.remoteProperties)
        && schedule.equals(other.schedule)
        && createdAt.equals(other.createdAt)
        && nextRunAt.equals(other.nextRunAt)
        && metadata.equals(other.metadata);
  }

  @Override
  public int hashCode() {
    return Objects.hash(
        id,
        name,
        owner,
        type,
        command,
        remoteProperties,
        schedule,
        retries,
        remainingRepeats,
        disabled,
        done,
        resumeAtNextScheduledTime,
        createdAt,
        nextRunAt,
        metadata);
  }

  @Override
  public String toString() {
    return MoreObjects.toStringHelper(this)
        .add("id", id)
        .add("name", name)
        .add("owner", owner)
        .add("type", type)
        .add("command", command)
        .add("remoteProperties", remoteProperties)
        .add("schedule", schedule)
        .add("retries", retries)
        .add("remainingRepeats", remainingRepeats)
        .add("disabled", disabled)
        .add("done", done)
        .add("nextRunAt", nextRunAt)
        .toString();
  }

  public static class Builder {
    private String id;
    private String name = "";
    private String owner = "";
    private JobType type;
    private String command = "";
    private RemoteProperties remoteProperties;
    private String schedule = "";
    private int retries;
    private Long remainingRepeats;
    private boolean disabled;
    private boolean done;
    private boolean resumeAtNextScheduledTime;
    private Instant createdAt;
    private Instant nextRunAt;
    private JobMetadata metadata = JobMetadata.EMPTY;

    public Builder setId(String id) {
      this.id = id;
      return this;
    }

    public Builder setName(String name) {
      this.name = Strings.nullToEmpty(name);
      return this;
    }

    public Builder setOwner(String owner) {
      this.owner = Strings.nullToEmpty(owner);
      return this;
    }

    public Builder setType(JobType type) {
      this.type = type;
      return this;
    }

    public Builder setCommand(String command) {
      this.command = Strings.nullToEmpty(command);
      return this;
    }

    public Builder setRemoteProperties(RemoteProperties remoteProperties) {
      this.remoteProperties = remoteProperties;
      return this;
    }

    public Builder setSchedule(String schedule) {
      this.schedule = Strings.nullToEmpty(schedule).trim();
      return this;
    }

    public Builder setRetries(int retries) {
      this.retries = retries;
      return this;
    }

    public Builder setRemainingRepeats(long remainingRepeats) {
      this.remainingRepeats = remainingRepeats;
      return this;
    }

    public Builder setDisabled(boolean disabled) {
      this.disabled = disabled;
      return this;
    }

    public Builder setDone(boolean done) {
      this.done = done;
      return this;
    }

    public Builder setResumeAtNextScheduledTime(boolean resumeAtNextScheduledTime) {
      this.resumeAtNextScheduledTime = resumeAtNextScheduledTime;
      return this;
    }

    public Builder setCreatedAt(Instant createdAt) {
      this.createdAt = createdAt;
      return this;
    }

    public Builder setNextRunAt(Instant nextRunAt) {
      this.nextRunAt = nextRunAt;
      return this;
    }

    public Builder setMetadata(JobMetadata metadata) {
      this.metadata = requireNonNull(metadata);
      return this;
    }

    /**
     * Builds the job.  A job without an id is assigned a random one, and a job whose remaining
     * repeats were never set derives them from its schedule.
     *
     * @return A validated job.
     * @throws IllegalArgumentException If the job is not exactly one of local or remote, or a
     *     count is out of range.
     */
    public Job build() {
      requireNonNull(type, "Job type must be set");
      if (type == JobType.LOCAL) {
        checkArgument(!command.trim().isEmpty(), "Local job requires a command");
        checkArgument(remoteProperties == null, "Local job must not have remote properties");
      } else {
        checkArgument(remoteProperties != null, "Remote job requires remote properties");
        checkArgument(command.isEmpty(), "Remote job must not have a command");
      }
      checkArgument(retries >= 0, "Retries must not be negative");

      if (Strings.isNullOrEmpty(id)) {
        id = UUID.randomUUID().toString();
      }
      if (remainingRepeats == null) {
        remainingRepeats = initialRepeats(schedule);
      }
      checkArgument(remainingRepeats >= Schedule.INDEFINITE, "Invalid remaining repeats");
      return new Job(this);
    }

    // A malformed schedule yields no repeats here; it is rejected when the job is added.
    private static long initialRepeats(String schedule) {
      if (schedule.isEmpty()) {
        return 0;
      }
      try {
        return Schedule.parse(schedule).getRepeat();
      } catch (MalformedScheduleException e) {
        return 0;
      }
    }
  }
}
