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

/**
 * Decides how long to wait after a failed attempt, before the next one begins.
 */
@FunctionalInterface
public interface WaitStrategy {
    /**
     * Waits before the attempt following the given one. Implementations must block the calling thread using
     * the given Clock, so that waits can be observed in tests.
     *
     * @param attemptIndex The zero-based index of the attempt that just failed.
     * @param clock        The Clock to wait on.
     */
    void await(int attemptIndex, Clock clock);
}
