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

import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

import javax.inject.Inject;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Module;
import com.google.inject.util.Modules;

import org.kronos.scheduler.AppStartup;
import org.kronos.scheduler.GuavaUtils.ServiceManagerIface;
import org.kronos.scheduler.SchedulerActive;
import org.kronos.scheduler.base.JobNotFoundException;
import org.kronos.scheduler.config.CliOptions;
import org.kronos.scheduler.config.CommandLine;
import org.kronos.scheduler.config.types.TimeAmount;
import org.kronos.scheduler.config.validators.PositiveAmount;
import org.kronos.scheduler.job.Job;
import org.kronos.scheduler.storage.JobStore;
import org.kronos.scheduler.storage.mem.MemStorageModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Launcher for the kronos scheduler.
 */
public class SchedulerMain {
  private static final Logger LOG = LoggerFactory.getLogger(SchedulerMain.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-jobs_file",
        description = "JSON file of job definitions added to the job store at startup. Jobs "
            + "whose ids are already stored are left untouched.")
    public File jobsFile;

    @Parameter(names = "-shutdown_timeout",
        validateValueWith = PositiveAmount.class,
        description = "Time to wait for services to stop before giving up on a clean shutdown.")
    public TimeAmount shutdownTimeout = new TimeAmount(5, TimeAmount.Unit.SECONDS);
  }

  @Inject
  @AppStartup
  private ServiceManagerIface startupServices;

  @Inject
  @SchedulerActive
  private ServiceManagerIface activeServices;

  @Inject private JobStore jobStore;

  private final CountDownLatch shutdown = new CountDownLatch(1);
  private final AtomicBoolean stopped = new AtomicBoolean(false);
  private TimeAmount shutdownTimeout = new TimeAmount(5, TimeAmount.Unit.SECONDS);

  @VisibleForTesting
  void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    LOG.info("Stopping scheduler services.");
    long timeoutMs = shutdownTimeout.asDuration().toMillis();
    try {
      activeServices.stopAsync().awaitStopped(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.info("Scheduler services did not stop in time: " + e);
    }
    try {
      startupServices.stopAsync().awaitStopped(timeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      LOG.info("Startup services did not stop in time: " + e);
    }
    jobStore.close();
    shutdown.countDown();
  }

  @VisibleForTesting
  void start(Options options) throws JobsFileLoader.JobsFileException {
    shutdownTimeout = options.shutdownTimeout;
    startupServices.startAsync().awaitHealthy();
    if (options.jobsFile != null) {
      seedJobs(options.jobsFile);
    }
    activeServices.startAsync().awaitHealthy();
    LOG.info("Scheduler started.");
  }

  void run(Options options) {
    try {
      Runtime.getRuntime().addShutdownHook(new Thread(SchedulerMain.this::stop, "ShutdownHook"));
      start(options);
      shutdown.await();
    } catch (JobsFileLoader.JobsFileException e) {
      throw new IllegalStateException("Failed to load jobs file.", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      LOG.info("Interrupted while running.");
    } finally {
      stop();
    }
  }

  private void seedJobs(File jobsFile) throws JobsFileLoader.JobsFileException {
    List<Job> jobs;
    try (Reader reader = Files.newBufferedReader(jobsFile.toPath(), StandardCharsets.UTF_8)) {
      jobs = JobsFileLoader.read(reader);
    } catch (IOException e) {
      throw new JobsFileLoader.JobsFileException("Failed to open " + jobsFile, e);
    }

    int added = 0;
    for (Job job : jobs) {
      if (isStored(job.getId())) {
        LOG.info("Job {} is already stored, not seeding it.", job.getId());
        continue;
      }
      jobStore.save(job);
      added++;
    }
    LOG.info("Seeded {} of {} jobs from {}", added, jobs.size(), jobsFile);
  }

  private boolean isStored(String jobId) {
    try {
      jobStore.get(jobId);
      return true;
    } catch (JobNotFoundException e) {
      return false;
    }
  }

  @VisibleForTesting
  static Module getUniversalModule(CliOptions options) {
    return Modules.combine(
        new AppModule(options),
        new MemStorageModule(options.storage));
  }

  /**
   * Runs the scheduler with modules configured from command line arguments.
   *
   * @param options Parsed command line options.
   */
  @VisibleForTesting
  public static void flagConfiguredMain(CliOptions options) {
    Thread.setDefaultUncaughtExceptionHandler(
        (t, e) -> LOG.error("Uncaught exception from " + t + ":" + e, e));

    Injector injector = Guice.createInjector(getUniversalModule(options));
    SchedulerMain scheduler = new SchedulerMain();
    injector.injectMembers(scheduler);
    try {
      scheduler.run(options.main);
    } finally {
      LOG.info("Application run() exited.");
    }
  }

  public static void main(String... args) {
    CliOptions options;
    try {
      options = CommandLine.parseOptions(args);
    } catch (ParameterException e) {
      System.exit(1);
      return;
    }
    flagConfiguredMain(options);
  }
}
