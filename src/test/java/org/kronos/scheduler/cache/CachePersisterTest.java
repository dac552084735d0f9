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

import org.junit.Before;
import org.junit.Test;
import org.kronos.common.testing.easymock.EasyMockTest;

public class CachePersisterTest extends EasyMockTest {

  private JobCache cache;

  @Before
  public void setUp() {
    cache = createMock(JobCache.class);
  }

  @Test
  public void testPersistsOnEachIteration() {
    cache.persistAll();
    cache.persistAll();

    control.replay();

    CachePersister persister = new CachePersister(cache, Duration.ofMinutes(1));
    persister.runForTest();
    persister.runForTest();
  }

  @Test
  public void testLifecycleStartsAndStopsCache() {
    cache.start();
    cache.stop();

    control.replay();

    CacheLifecycle lifecycle = new CacheLifecycle(cache);
    lifecycle.startAsync().awaitRunning();
    lifecycle.stopAsync().awaitTerminated();
  }
}
