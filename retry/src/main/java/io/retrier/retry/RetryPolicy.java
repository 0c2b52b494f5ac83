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
import java.util.Arrays;
import java.util.function.Predicate;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Immutable set of rules that drive a {@link Retrier}: how many attempts to make, which failures to retry, how long
 * to wait between attempts and which {@link Clock} to use for it.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class RetryPolicy {
    /**
     * Number of attempts made when none is configured.
     */
    public static final int DEFAULT_MAX_ATTEMPTS = 4;

    /**
     * Base of the exponential backoff used when no {@link WaitStrategy} is configured.
     */
    public static final double DEFAULT_BACKOFF_FACTOR = 2;

    private final int maxAttempts;
    private final Predicate<Throwable> classifier;
    private final WaitStrategy waitStrategy;
    private final Clock clock;

    /**
     * Creates a new Builder.
     *
     * @return A new Builder.
     */
    public static Builder builder() {
        return new Builder();
    }

    /**
     * Creates a RetryPolicy with all the defaults: {@link #DEFAULT_MAX_ATTEMPTS} attempts, retrying all failures,
     * with exponential backoff of base {@link #DEFAULT_BACKOFF_FACTOR} on the system Clock.
     *
     * @return The default RetryPolicy.
     */
    public static RetryPolicy defaults() {
        return builder().build();
    }

    @Override
    public String toString() {
        return String.format("RetryPolicy(maxAttempts=%d, waitStrategy=%s, clock=%s)", this.maxAttempts, this.waitStrategy, this.clock);
    }

    /**
     * Collects the settings of a {@link RetryPolicy}. Setting a value more than once keeps the last one; anything left
     * unset receives its default value in {@link #build()}.
     */
    public static final class Builder {
        private Integer maxAttempts;
        private Predicate<Throwable> classifier;
        private WaitStrategy waitStrategy;
        private Clock clock;

        private Builder() {
        }

        public Builder maxAttempts(int maxAttempts) {
            Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be a positive integer.");
            this.maxAttempts = maxAttempts;
            return this;
        }

        public Builder classifier(Predicate<Throwable> classifier) {
            this.classifier = Preconditions.checkNotNull(classifier, "classifier");
            return this;
        }

        public Builder waitStrategy(WaitStrategy waitStrategy) {
            this.waitStrategy = Preconditions.checkNotNull(waitStrategy, "waitStrategy");
            return this;
        }

        public Builder clock(Clock clock) {
            this.clock = Preconditions.checkNotNull(clock, "clock");
            return this;
        }

        /**
         * Applies the given options, in order.
         *
         * @param options The options to apply.
         * @return This instance.
         */
        public Builder apply(RetryOption... options) {
            return apply(Arrays.asList(options));
        }

        /**
         * Applies the given options, in order.
         *
         * @param options The options to apply.
         * @return This instance.
         */
        public Builder apply(Iterable<? extends RetryOption> options) {
            Preconditions.checkNotNull(options, "options");
            for (RetryOption option : options) {
                Preconditions.checkNotNull(option, "option").applyTo(this);
            }
            return this;
        }

        /**
         * Creates a new RetryPolicy, filling in defaults for every setting that was not provided.
         *
         * @return The RetryPolicy.
         */
        public RetryPolicy build() {
            return new RetryPolicy(
                    this.maxAttempts == null ? DEFAULT_MAX_ATTEMPTS : this.maxAttempts,
                    this.classifier == null ? Classifiers.retryOnAll() : this.classifier,
                    this.waitStrategy == null ? WaitStrategies.exponential(DEFAULT_BACKOFF_FACTOR) : this.waitStrategy,
                    this.clock == null ? Clock.system() : this.clock);
        }
    }
}
