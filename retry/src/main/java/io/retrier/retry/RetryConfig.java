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

import com.google.common.collect.ImmutableList;
import io.retrier.common.util.ConfigBuilder;
import io.retrier.common.util.Property;
import io.retrier.common.util.TypedProperties;
import java.time.Duration;
import java.time.temporal.ChronoUnit;
import java.util.List;
import lombok.Getter;

/**
 * Property-based configuration for a {@link RetryPolicy}. Properties live in the "retry" namespace, for example:
 * <pre>
 * retry.maxAttempts=5
 * retry.backoff=CONSTANT
 * retry.constantDelayMillis=250
 * </pre>
 */
public class RetryConfig {
    //region Config Names

    public static final Property<Integer> MAX_ATTEMPTS = Property.ofInt("maxAttempts", RetryPolicy.DEFAULT_MAX_ATTEMPTS)
            .withLegacyName("attempts")
            .requiring(v -> v > 0, "a positive integer");
    public static final Property<Backoff> BACKOFF = Property.ofEnum("backoff", Backoff.class, Backoff.EXPONENTIAL);
    public static final Property<Double> BACKOFF_FACTOR = Property.ofDouble("backoffFactor", RetryPolicy.DEFAULT_BACKOFF_FACTOR)
            .requiring(v -> v > 0 && !v.isInfinite(), "a positive number");
    public static final Property<Long> CONSTANT_DELAY_MILLIS = Property.ofLong("constantDelayMillis", 1000L)
            .requiring(v -> v >= 0, "zero or more milliseconds");
    public static final Property<Long> MAX_DELAY_MILLIS = Property.ofLong("maxDelayMillis", 0L)
            .requiring(v -> v >= 0, "zero (unlimited) or more milliseconds");
    private static final String NAMESPACE = "retry";

    //endregion

    //region Members

    /**
     * The maximum number of attempts.
     */
    @Getter
    private final int maxAttempts;

    /**
     * The kind of wait between attempts.
     */
    @Getter
    private final Backoff backoff;

    /**
     * The base of the exponent, for {@link Backoff#EXPONENTIAL}.
     */
    @Getter
    private final double backoffFactor;

    /**
     * The wait between attempts, for {@link Backoff#CONSTANT}.
     */
    @Getter
    private final Duration constantDelay;

    /**
     * The longest wait for {@link Backoff#EXPONENTIAL}. Zero means unlimited.
     */
    @Getter
    private final Duration maxDelay;

    //endregion

    //region Constructor

    private RetryConfig(TypedProperties properties) {
        this.maxAttempts = properties.get(MAX_ATTEMPTS);
        this.backoff = properties.get(BACKOFF);
        this.backoffFactor = properties.get(BACKOFF_FACTOR);
        this.constantDelay = properties.getDuration(CONSTANT_DELAY_MILLIS, ChronoUnit.MILLIS);
        this.maxDelay = properties.getDuration(MAX_DELAY_MILLIS, ChronoUnit.MILLIS);
    }

    /**
     * Creates a new ConfigBuilder that can be used to create instances of this class. Use
     * {@link ConfigBuilder#withProperties} to read values from a java.util.Properties object.
     *
     * @return A new Builder for this class.
     */
    public static ConfigBuilder<RetryConfig> builder() {
        return new ConfigBuilder<>(NAMESPACE, RetryConfig::new);
    }

    //endregion

    /**
     * Creates the WaitStrategy described by this configuration.
     *
     * @return The WaitStrategy.
     */
    public WaitStrategy createWaitStrategy() {
        switch (this.backoff) {
            case CONSTANT:
                return WaitStrategies.constant(this.constantDelay);
            case NONE:
                return WaitStrategies.none();
            case EXPONENTIAL:
            default:
                return WaitStrategies.exponential(this.backoffFactor, this.maxDelay.isZero() ? null : this.maxDelay);
        }
    }

    /**
     * Gets the RetryOptions which apply this configuration.
     *
     * @return An ordered list of RetryOptions.
     */
    public List<RetryOption> toOptions() {
        return ImmutableList.of(
                RetryOptions.withMaxAttempts(this.maxAttempts),
                RetryOptions.withWaitStrategy(createWaitStrategy()));
    }

    @Override
    public String toString() {
        return String.format("RetryConfig(maxAttempts=%d, backoff=%s, backoffFactor=%s, constantDelay=%s, maxDelay=%s)",
                this.maxAttempts, this.backoff, this.backoffFactor, this.constantDelay, this.maxDelay);
    }

    /**
     * The kinds of waits between attempts.
     */
    public enum Backoff {
        EXPONENTIAL,
        CONSTANT,
        NONE
    }
}
