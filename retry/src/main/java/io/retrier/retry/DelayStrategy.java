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

import com.google.common.base.Preconditions;
import java.time.Duration;

/**
 * A {@link WaitStrategy} whose waits are a pure function of the attempt index.
 */
public abstract class DelayStrategy implements WaitStrategy {
    /**
     * Gets the amount of time to wait after the given attempt failed.
     *
     * @param attemptIndex The zero-based index of the attempt that just failed.
     * @return The time to wait until the next attempt.
     */
    public abstract Duration getDelay(int attemptIndex);

    @Override
    public final void await(int attemptIndex, Clock clock) {
        Preconditions.checkArgument(attemptIndex >= 0, "attemptIndex cannot be negative.");
        clock.sleep(getDelay(attemptIndex));
    }
}
