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
import io.retrier.common.Exceptions;
import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * Factory methods for the built-in {@link WaitStrategy} implementations.
 */
public final class WaitStrategies {
    private static final double NANOS_PER_SECOND = TimeUnit.SECONDS.toNanos(1);
    private static final WaitStrategy NONE = (attemptIndex, clock) -> {
    };

    private WaitStrategies() {
    }

    /**
     * Waits {@code factor^i} seconds after the attempt with index {@code i}, i.e., 1s after the first attempt
     * regardless of the factor.
     *
     * @param factor The base of the exponent. Must be a positive number; it need not be an integer.
     * @return The strategy.
     */
    public static DelayStrategy exponential(double factor) {
        return exponential(factor, null);
    }

    /**
     * Same as {@link #exponential(double)}, but never waits longer than maxDelay.
     *
     * @param factor   The base of the exponent. Must be a positive number.
     * @param maxDelay The longest wait, or null for no limit.
     * @return The strategy.
     */
    public static DelayStrategy exponential(double factor, Duration maxDelay) {
        Exceptions.checkArgument(factor > 0 && !Double.isInfinite(factor), "factor", "Must be a positive number, given %s.", factor);
        Preconditions.checkArgument(maxDelay == null || !maxDelay.isNegative(), "maxDelay cannot be negative.");
        return new ExponentialDelay(factor, maxDelay);
    }

    /**
     * Waits the same amount of time after every attempt.
     *
     * @param delay The time to wait.
     * @return The strategy.
     */
    public static DelayStrategy constant(Duration delay) {
        Preconditions.checkNotNull(delay, "delay");
        Preconditions.checkArgument(!delay.isNegative(), "delay cannot be negative.");
        return new ConstantDelay(delay);
    }

    /**
     * Does not wait at all between attempts.
     *
     * @return The strategy.
     */
    public static WaitStrategy none() {
        return NONE;
    }

    private static final class ExponentialDelay extends DelayStrategy {
        private final double factor;
        private final Duration maxDelay;

        ExponentialDelay(double factor, Duration maxDelay) {
            this.factor = factor;
            this.maxDelay = maxDelay;
        }

        @Override
        public Duration getDelay(int attemptIndex) {
            // Math.round saturates at Long.MAX_VALUE.
            long nanos = Math.round(Math.pow(this.factor, attemptIndex) * NANOS_PER_SECOND);
            Duration delay = Duration.ofNanos(nanos);
            if (this.maxDelay != null && delay.compareTo(this.maxDelay) > 0) {
                return this.maxDelay;
            }
            return delay;
        }

        @Override
        public String toString() {
            return String.format("Exponential(factor=%s, maxDelay=%s)", this.factor, this.maxDelay);
        }
    }

    private static final class ConstantDelay extends DelayStrategy {
        private final Duration delay;

        ConstantDelay(Duration delay) {
            this.delay = delay;
        }

        @Override
        public Duration getDelay(int attemptIndex) {
            return this.delay;
        }

        @Override
        public String toString() {
            return String.format("Constant(%s)", this.delay);
        }
    }
}
