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

import javax.inject.Inject;

import com.google.common.util.concurrent.AbstractIdleService;

import static java.util.Objects.requireNonNull;

/**
 * Loads the job cache when the scheduler becomes active and stops it on shutdown.
 */
class CacheLifecycle extends AbstractIdleService {
  private final JobCache cache;

  @Inject
  CacheLifecycle(JobCache cache) {
    this.cache = requireNonNull(cache);
  }

  @Override
  protected void startUp() {
    cache.start();
  }

  @Override
  protected void shutDown() {
    cache.stop();
  }
}
