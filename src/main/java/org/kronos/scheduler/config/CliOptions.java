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
package org.kronos.scheduler.config;

import org.kronos.scheduler.app.SchedulerMain;
import org.kronos.scheduler.async.AsyncModule;
import org.kronos.scheduler.cache.CacheModule;
import org.kronos.scheduler.execution.ExecutionModule;
import org.kronos.scheduler.pruning.PruningModule;
import org.kronos.scheduler.storage.mem.MemStorageModule;

public class CliOptions {
  public final SchedulerMain.Options main = new SchedulerMain.Options();
  public final AsyncModule.Options async = new AsyncModule.Options();
  public final MemStorageModule.Options storage = new MemStorageModule.Options();
  public final CacheModule.Options cache = new CacheModule.Options();
  public final ExecutionModule.Options execution = new ExecutionModule.Options();
  public final PruningModule.Options pruning = new PruningModule.Options();
}
