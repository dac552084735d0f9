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

import java.time.Duration;
import java.util.concurrent.TimeUnit;

import javax.inject.Inject;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.util.concurrent.AbstractScheduledService;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Objects.requireNonNull;

/**
 * Periodically saves the cached job snapshots, so run bookkeeping survives a crash.
 */
class CachePersister extends AbstractScheduledService {
  private static final Logger LOG = LoggerFactory.getLogger(CachePersister.class);

  private final JobCache cache;
  private final Duration interval;

  @Inject
  CachePersister(JobCache cache, @CacheModule.PersistInterval Duration interval) {
    this.cache = requireNonNull(cache);
    this.interval = requireNonNull(interval);
  }

  @Override
  protected Scheduler scheduler() {
    return Scheduler.newFixedDelaySchedule(
        interval.toMillis(),
        interval.toMillis(),
        TimeUnit.MILLISECONDS);
  }

  @VisibleForTesting
  void runForTest() {
    runOneIteration();
  }

  @Override
  protected void runOneIteration() {
    LOG.debug("Persisting cached jobs");
    cache.persistAll();
  }
}
