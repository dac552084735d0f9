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
package org.kronos.scheduler.stats;

import javax.inject.Singleton;

import com.google.inject.AbstractModule;

import org.kronos.common.stats.StatsProvider;
import org.kronos.common.stats.StatsRegistry;
import org.kronos.scheduler.SchedulerServicesModule;

/**
 * Binding module for the in-process stats registry and job summary gauges.
 */
public class StatsModule extends AbstractModule {
  @Override
  protected void configure() {
    bind(StatsRegistry.class).in(Singleton.class);
    bind(StatsProvider.class).to(StatsRegistry.class);

    bind(JobStatsExporter.class).in(Singleton.class);
    SchedulerServicesModule.addAppStartupServiceBinding(binder()).to(JobStatsExporter.class);
  }
}
