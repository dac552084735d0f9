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
package org.kronos.common.util;

import java.time.Instant;

/**
 * Source of the current time and of waits measured against it. Scheduling code reads time only
 * through this interface so tests can substitute a fake.
 */
public interface Clock {
  /**
   * Wall clock time, waiting by sleeping the calling thread.
   */
  Clock SYSTEM_CLOCK = new Clock() {
    @Override public Instant nowInstant() {
      return Instant.now();
    }
    @Override public void waitFor(long millis) throws InterruptedException {
      Thread.sleep(millis);
    }
  };

  /**
   * Returns the current time.
   *
   * @return The current instant according to this clock.
   */
  Instant nowInstant();

  /**
   * Blocks until {@code millis} milliseconds have passed on this clock.
   *
   * @param millis Time to wait, in milliseconds.
   * @throws InterruptedException If the wait was interrupted.
   */
  void waitFor(long millis) throws InterruptedException;
}
