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
import java.util.Optional;

import org.junit.Test;
import org.kronos.scheduler.schedule.MalformedScheduleException;
import org.kronos.scheduler.schedule.Schedule;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertTrue;

public class JobTest {

  private static final RemoteProperties REMOTE =
      RemoteProperties.newBuilder().setUrl("http://localhost:8080/hook").build();

  private static Job.Builder local() {
    return Job.newBuilder().setType(JobType.LOCAL).setCommand("echo hi");
  }

  @Test
  public void testDefaults() throws Exception {
    Job job = local().build();
    assertFalse(job.getId().isEmpty());
    assertNotEquals(job.getId(), local().build().getId());
    assertEquals("", job.getSchedule());
    assertEquals(Optional.empty(), job.getParsedSchedule());
    assertEquals(0, job.getRemainingRepeats());
    assertEquals(0, job.getRetries());
    assertEquals(Optional.empty(), job.getNextRunAt());
    assertEquals(JobMetadata.EMPTY, job.getMetadata());
    assertFalse(job.isDisabled());
    assertFalse(job.isDone());
  }

  @Test
  public void testRepeatsDerivedFromSchedule() throws Exception {
    Job job = local().setSchedule(" R2/2024-01-01T00:00:00Z/P1D ").build();
    assertEquals("R2/2024-01-01T00:00:00Z/P1D", job.getSchedule());
    assertEquals(2, job.getRemainingRepeats());
    assertEquals(Schedule.parse("R2/2024-01-01T00:00:00Z/P1D"), job.getParsedSchedule().get());

    assertEquals(
        Schedule.INDEFINITE,
        local().setSchedule("R/2024-01-01T00:00:00Z/PT1H").build().getRemainingRepeats());
    assertEquals(
        1,
        local().setSchedule("R2/2024-01-01T00:00:00Z/P1D").setRemainingRepeats(1).build()
            .getRemainingRepeats());
  }

  @Test(expected = MalformedScheduleException.class)
  public void testMalformedSchedule() throws Exception {
    Job job = local().setSchedule("R2/yesterday/P1D").build();
    assertEquals(0, job.getRemainingRepeats());
    job.getParsedSchedule();
  }

  @Test
  public void testToBuilderCopiesEverything() {
    Job job = local()
        .setId("a")
        .setName("name")
        .setOwner("owner@example.com")
        .setSchedule("R/2024-01-01T00:00:00Z/P1D")
        .setRetries(3)
        .setDisabled(true)
        .setResumeAtNextScheduledTime(true)
        .setCreatedAt(Instant.EPOCH)
        .setNextRunAt(Instant.parse("2024-01-02T00:00:00Z"))
        .build();
    assertEquals(job, job.toBuilder().build());
    assertEquals(job.hashCode(), job.toBuilder().build().hashCode());
    assertNotEquals(job, job.toBuilder().setDone(true).build());
  }

  @Test
  public void testRemoteJob() {
    Job job = Job.newBuilder().setType(JobType.REMOTE).setRemoteProperties(REMOTE).build();
    assertEquals(Optional.of(REMOTE), job.getRemoteProperties());
    assertEquals("", job.getCommand());
    assertTrue(job.getType() == JobType.REMOTE);
  }

  @Test(expected = NullPointerException.class)
  public void testTypeRequired() {
    Job.newBuilder().setCommand("echo").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLocalRequiresCommand() {
    Job.newBuilder().setType(JobType.LOCAL).setCommand("  ").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testLocalRejectsRemoteProperties() {
    local().setRemoteProperties(REMOTE).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRemoteRequiresProperties() {
    Job.newBuilder().setType(JobType.REMOTE).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testRemoteRejectsCommand() {
    Job.newBuilder().setType(JobType.REMOTE).setRemoteProperties(REMOTE).setCommand("ls").build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeRetries() {
    local().setRetries(-1).build();
  }
}
