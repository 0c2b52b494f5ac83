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

import java.time.Instant;
import lombok.Data;

/**
 * Describes a single invocation of an {@link AttemptOperation}.
 */
@Data
public class Attempt {
    /**
     * Zero-based index of this attempt.
     */
    private final int index;

    /**
     * The instant at which the previous attempt started, or null if this is the first attempt.
     */
    private final Instant previousAttemptStart;

    /**
     * Gets a value indicating whether this is the first attempt.
     *
     * @return True if this is the first attempt.
     */
    public boolean isFirst() {
        return this.index == 0;
    }
}
