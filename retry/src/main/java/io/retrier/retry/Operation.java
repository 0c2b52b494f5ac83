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
 * A unit of work that can be retried.
 */
@FunctionalInterface
public interface Operation {
    /**
     * Runs the operation once.
     *
     * @throws Exception If the attempt failed.
     */
    void run() throws Exception;

    /**
     * Adapts this Operation to an {@link AttemptOperation} which ignores the attempt it is given.
     *
     * @return An AttemptOperation that delegates to this Operation.
     */
    default AttemptOperation asAttemptOperation() {
        return attempt -> run();
    }
}
