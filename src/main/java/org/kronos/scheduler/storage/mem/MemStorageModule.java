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
package org.kronos.scheduler.storage.mem;

import java.time.Duration;

import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.PrivateModule;

import org.kronos.scheduler.config.types.TimeAmount;
import org.kronos.scheduler.config.validators.PositiveAmount;
import org.kronos.scheduler.storage.JobStore;
import org.kronos.scheduler.storage.RunStore;

import static java.util.Objects.requireNonNull;

/**
 * Binding module for in-memory stores.
 */
public final class MemStorageModule extends PrivateModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-run_retention",
        validateValueWith = PositiveAmount.class,
        description = "Time a finished run is kept before it becomes eligible for pruning.")
    public TimeAmount runRetention = new TimeAmount(7, TimeAmount.Unit.DAYS);
  }

  private final Duration runRetention;

  public MemStorageModule(Options options) {
    this(options.runRetention.asDuration());
  }

  public MemStorageModule(Duration runRetention) {
    this.runRetention = requireNonNull(runRetention);
  }

  private <T> void bindStore(Class<T> binding, Class<? extends T> impl) {
    bind(binding).to(impl);
    bind(impl).in(Singleton.class);
    expose(binding);
  }

  @Override
  protected void configure() {
    bind(Duration.class).annotatedWith(MemRunStore.RunRetention.class).toInstance(runRetention);
    bindStore(JobStore.class, MemJobStore.class);
    bindStore(RunStore.class, MemRunStore.class);
  }
}
