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
 * A unit of work that can be retried, which receives information about the attempt it is running as.
 */
@FunctionalInterface
public interface AttemptOperation {
    /**
     * Runs the operation once.
     *
     * @param attempt The current attempt.
     * @throws Exception If the attempt failed.
     */
    void run(Attempt attempt) throws Exception;
}
