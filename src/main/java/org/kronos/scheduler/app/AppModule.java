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

import com.google.inject.AbstractModule;

import org.kronos.common.util.Clock;
import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.async.AsyncModule;
import org.kronos.scheduler.cache.CacheModule;
import org.kronos.scheduler.config.CliOptions;
import org.kronos.scheduler.events.PubsubEventModule;
import org.kronos.scheduler.execution.ExecutionModule;
import org.kronos.scheduler.pruning.PruningModule;
import org.kronos.scheduler.stats.StatsModule;

import static java.util.Objects.requireNonNull;

/**
 * Binding module for the scheduling and execution engine, independent of the storage backend.
 */
public class AppModule extends AbstractModule {
  private final CliOptions options;

  public AppModule(CliOptions options) {
    this.options = requireNonNull(options);
  }

  @Override
  protected void configure() {
    bind(Clock.class).toInstance(Clock.SYSTEM_CLOCK);

    install(new SchedulerServicesModule());
    install(new StatsModule());
    install(new AsyncModule(options.async));
    install(new PubsubEventModule());
    install(new CacheModule(options.cache));
    install(new ExecutionModule(options.execution));
    install(new PruningModule(options.pruning));
  }
}
