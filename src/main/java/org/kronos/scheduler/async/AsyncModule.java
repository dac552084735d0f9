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
package org.kronos.scheduler.async;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadPoolExecutor;

import javax.inject.Inject;
import javax.inject.Qualifier;
import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractIdleService;
import com.google.inject.AbstractModule;
import com.google.inject.PrivateModule;

import org.kronos.common.stats.StatsProvider;
import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.base.AsyncUtil;
import org.kronos.scheduler.config.validators.PositiveNumber;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;
import static java.util.Objects.requireNonNull;

/**
 * Binding module for the thread pools that arm timers, execute runs and deliver events.
 */
public class AsyncModule extends AbstractModule {
  private static final Logger LOG = LoggerFactory.getLogger(AsyncModule.class);

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-timer_threads",
        validateValueWith = PositiveNumber.class,
        description = "The number of threads that fire job timers.")
    public int timerThreads = 2;

    @Parameter(names = "-job_worker_threads",
        validateValueWith = PositiveNumber.class,
        description = "The maximum number of job runs that execute concurrently.")
    public int jobWorkerThreads = 16;
  }

  /**
   * Binding annotation for the executor that fires job timers.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface TimerExecutor { }

  /**
   * Binding annotation for the executor that runs jobs.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface WorkerExecutor { }

  /**
   * Binding annotation for the executor that delivers events.
   */
  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  public @interface AsyncExecutor { }

  private final ScheduledThreadPoolExecutor timers;
  private final ThreadPoolExecutor workers;
  private final ScheduledThreadPoolExecutor events;

  public AsyncModule(Options options) {
    // These can be daemon and cleanup-free, in-flight runs are abandoned at VM exit.
    this(
        AsyncUtil.loggingScheduledExecutor(options.timerThreads, "JobTimer-%d", LOG),
        AsyncUtil.loggingExecutor(options.jobWorkerThreads, "JobWorker-%d", LOG),
        AsyncUtil.singleThreadLoggingScheduledExecutor("EventDelivery-%d", LOG));
  }

  @VisibleForTesting
  public AsyncModule(
      ScheduledThreadPoolExecutor timers,
      ThreadPoolExecutor workers,
      ScheduledThreadPoolExecutor events) {

    this.timers = requireNonNull(timers);
    this.workers = requireNonNull(workers);
    this.events = requireNonNull(events);
  }

  @Override
  protected void configure() {
    install(new PrivateModule() {
      @Override
      protected void configure() {
        bind(ScheduledThreadPoolExecutor.class).toInstance(timers);
        bind(ThreadPoolExecutor.class).toInstance(workers);
        bind(RegisterGauges.class).in(Singleton.class);
        expose(RegisterGauges.class);
      }
    });
    SchedulerServicesModule.addAppStartupServiceBinding(binder()).to(RegisterGauges.class);

    bind(ScheduledExecutorService.class).annotatedWith(TimerExecutor.class).toInstance(timers);
    bind(ExecutorService.class).annotatedWith(WorkerExecutor.class).toInstance(workers);
    bind(Executor.class).annotatedWith(AsyncExecutor.class).toInstance(events);
  }

  static class RegisterGauges extends AbstractIdleService {
    @VisibleForTesting
    static final String TIMER_QUEUE_GAUGE = "timer_queue_size";

    @VisibleForTesting
    static final String WORKER_QUEUE_GAUGE = "job_worker_queue_size";

    @VisibleForTesting
    static final String ACTIVE_RUNS_GAUGE = "job_worker_active";

    private final StatsProvider statsProvider;
    private final ScheduledThreadPoolExecutor timers;
    private final ThreadPoolExecutor workers;

    @Inject
    RegisterGauges(
        StatsProvider statsProvider,
        ScheduledThreadPoolExecutor timers,
        ThreadPoolExecutor workers) {

      this.statsProvider = requireNonNull(statsProvider);
      this.timers = requireNonNull(timers);
      this.workers = requireNonNull(workers);
    }

    @Override
    protected void startUp() {
      statsProvider.makeGauge(TIMER_QUEUE_GAUGE, () -> timers.getQueue().size());
      statsProvider.makeGauge(WORKER_QUEUE_GAUGE, () -> workers.getQueue().size());
      statsProvider.makeGauge(ACTIVE_RUNS_GAUGE, workers::getActiveCount);
    }

    @Override
    protected void shutDown() {
      // Nothing to do - await VM shutdown.
    }
  }
}
