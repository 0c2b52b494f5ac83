/**
 * Copyright Pravega Authors.
 *
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
package io.retrier.retry;

import java.time.Duration;
import java.time.Instant;

/**
 * Source of time for a {@link Retrier}: tells it what time it is and makes it wait between attempts.
 * Replace it to make waits observable (and instantaneous) in tests.
 */
public interface Clock {
    /**
     * Gets the current instant.
     *
     * @return The current instant.
     */
    Instant now();

    /**
     * Blocks the calling thread for the given duration.
     *
     * @param duration The amount of time to wait. Zero or negative durations return immediately.
     */
    void sleep(Duration duration);

    /**
     * Gets a Clock backed by the system wall clock.
     *
     * @return The system Clock.
     */
    static Clock system() {
        return SystemClock.INSTANCE;
    }
}
