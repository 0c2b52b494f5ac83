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
 * A single change to the settings of a {@link RetryPolicy}. See {@link RetryOptions} for the available ones.
 */
@FunctionalInterface
public interface RetryOption {
    /**
     * Applies this option.
     *
     * @param builder The Builder to update.
     */
    void applyTo(RetryPolicy.Builder builder);
}
