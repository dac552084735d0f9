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
package org.kronos.scheduler.pruning;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;
import com.google.inject.PrivateModule;

import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.config.types.TimeAmount;
import org.kronos.scheduler.config.validators.PositiveAmount;

/**
 * Binding module for background run history pruning.
 */
public class PruningModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-run_prune_interval",
        validateValueWith = PositiveAmount.class,
        description = "Run history pruning interval.")
    public TimeAmount runPruneInterval = new TimeAmount(15, TimeAmount.Unit.MINUTES);
  }

  private final Options options;

  public PruningModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    install(new PrivateModule() {
      @Override
      protected void configure() {
        bind(RunHistoryPruner.HistoryPrunerSettings.class).toInstance(
            new RunHistoryPruner.HistoryPrunerSettings(options.runPruneInterval.asDuration()));

        bind(RunHistoryPruner.class).in(Singleton.class);
        expose(RunHistoryPruner.class);
      }
    });
    SchedulerServicesModule.addSchedulerActiveServiceBinding(binder())
        .to(RunHistoryPruner.class);
  }
}
