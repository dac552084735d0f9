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
package org.kronos.scheduler.events;

import java.time.Instant;
import java.util.concurrent.Executor;

import com.google.common.eventbus.Subscribe;
import com.google.common.util.concurrent.ListenableFuture;
import com.google.common.util.concurrent.MoreExecutors;
import com.google.inject.AbstractModule;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;

import org.junit.Before;
import org.junit.Test;
import org.kronos.common.stats.StatsProvider;
import org.kronos.common.stats.StatsRegistry;
import org.kronos.scheduler.AppStartup;
import org.kronos.scheduler.GuavaUtils.ServiceManagerIface;
import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.async.AsyncModule.AsyncExecutor;
import org.kronos.scheduler.events.PubsubEvent.EventSubscriber;
import org.kronos.scheduler.events.PubsubEvent.RunFinished;
import org.kronos.scheduler.job.JobStat;

import static org.junit.Assert.assertEquals;

public class PubsubEventModuleTest {

  private static final Instant NOW = Instant.parse("2024-01-01T00:00:00Z");

  private StatsRegistry stats;

  @Before
  public void setUp() {
    stats = new StatsRegistry();
  }

  public static class ThrowingSubscriber implements EventSubscriber {
    @Subscribe
    public void runFinished(RunFinished event) {
      throw new IllegalStateException("subscriber failure");
    }
  }

  private Injector createInjector(AbstractModule extra) {
    Injector injector = Guice.createInjector(
        new SchedulerServicesModule(),
        new PubsubEventModule(),
        new AbstractModule() {
          @Override
          protected void configure() {
            bind(StatsProvider.class).toInstance(stats);
            bind(Executor.class).annotatedWith(AsyncExecutor.class)
                .toInstance(MoreExecutors.directExecutor());
          }
        },
        extra);
    injector.getInstance(Key.get(ServiceManagerIface.class, AppStartup.class))
        .startAsync()
        .awaitHealthy();
    return injector;
  }

  @Test
  public void testRunFinishedReachesCompletions() throws Exception {
    Injector injector = createInjector(new AbstractModule() {
      @Override
      protected void configure() {
        // No extra bindings.
      }
    });

    ListenableFuture<JobStat> future =
        injector.getInstance(RunCompletions.class).awaitNextRun("a");
    JobStat run = JobStat.started("a", NOW, false).succeeded(NOW);
    injector.getInstance(EventSink.class).post(new RunFinished(run, false));

    assertEquals(run, future.get());
    assertEquals(0L, stats.getLongValue(PubsubEventModule.EXCEPTIONS_STAT));
    assertEquals(0L, stats.getLongValue(PubsubEventModule.EVENT_BUS_DEAD_EVENTS));
  }

  @Test
  public void testDeadEvent() {
    Injector injector = createInjector(new AbstractModule() {
      @Override
      protected void configure() {
        // No extra bindings.
      }
    });

    injector.getInstance(EventSink.class).post(new PubsubEvent() { });
    assertEquals(1L, stats.getLongValue(PubsubEventModule.EVENT_BUS_DEAD_EVENTS));
  }

  @Test
  public void testSubscriberExceptionCounted() throws Exception {
    Injector injector = createInjector(new AbstractModule() {
      @Override
      protected void configure() {
        PubsubEventModule.bindSubscriber(binder(), ThrowingSubscriber.class);
      }
    });

    ListenableFuture<JobStat> future =
        injector.getInstance(RunCompletions.class).awaitNextRun("a");
    JobStat run = JobStat.started("a", NOW, false).failed(NOW, "exit 1");
    injector.getInstance(EventSink.class).post(new RunFinished(run, true));

    assertEquals(run, future.get());
    assertEquals(1L, stats.getLongValue(PubsubEventModule.EXCEPTIONS_STAT));
  }
}
