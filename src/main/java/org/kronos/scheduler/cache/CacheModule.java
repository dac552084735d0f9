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
package org.kronos.scheduler.cache;

import java.lang.annotation.Retention;
import java.lang.annotation.Target;
import java.time.Duration;

import javax.inject.Qualifier;
import javax.inject.Singleton;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.inject.AbstractModule;
import com.google.inject.PrivateModule;

import org.kronos.scheduler.SchedulerServicesModule;
import org.kronos.scheduler.config.types.TimeAmount;
import org.kronos.scheduler.config.validators.PositiveAmount;

import static java.lang.annotation.ElementType.FIELD;
import static java.lang.annotation.ElementType.METHOD;
import static java.lang.annotation.ElementType.PARAMETER;
import static java.lang.annotation.RetentionPolicy.RUNTIME;

/**
 * Binding module for the job cache and the services that load and persist it.
 */
public class CacheModule extends AbstractModule {

  @Parameters(separators = "=")
  public static class Options {
    @Parameter(names = "-persist_interval",
        validateValueWith = PositiveAmount.class,
        description = "Interval at which cached job snapshots are saved to the job store.")
    public TimeAmount persistInterval = new TimeAmount(1, TimeAmount.Unit.MINUTES);
  }

  @Qualifier
  @Target({ FIELD, PARAMETER, METHOD }) @Retention(RUNTIME)
  @interface PersistInterval { }

  private final Options options;

  public CacheModule(Options options) {
    this.options = options;
  }

  @Override
  protected void configure() {
    bind(JobCache.class).to(LockFreeJobCache.class);
    bind(LockFreeJobCache.class).in(Singleton.class);

    install(new PrivateModule() {
      @Override
      protected void configure() {
        bind(Duration.class).annotatedWith(PersistInterval.class)
            .toInstance(options.persistInterval.asDuration());
        bind(CachePersister.class).in(Singleton.class);
        expose(CachePersister.class);
        bind(CacheLifecycle.class).in(Singleton.class);
        expose(CacheLifecycle.class);
      }
    });
    SchedulerServicesModule.addSchedulerActiveServiceBinding(binder()).to(CacheLifecycle.class);
    SchedulerServicesModule.addSchedulerActiveServiceBinding(binder()).to(CachePersister.class);
  }
}
