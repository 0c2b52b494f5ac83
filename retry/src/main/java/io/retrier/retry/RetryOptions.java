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
import java.util.function.Predicate;

/**
 * Factory methods for {@link RetryOption}s.
 * <p>
 * Usage:
 * <pre>
 * {@code
 * Retrier.of(() -> client.send(request),
 *         RetryOptions.withMaxAttempts(10),
 *         RetryOptions.withWhitelist(new ConnectException("Connection refused")),
 *         RetryOptions.withExpBackoff(2))
 *        .runOrThrow();
 * }
 * </pre>
 */
public final class RetryOptions {
    private RetryOptions() {
    }

    /**
     * Sets the maximum number of attempts, the first one included.
     *
     * @param maxAttempts The number of attempts. Must be positive.
     * @return The option.
     */
    public static RetryOption withMaxAttempts(int maxAttempts) {
        Preconditions.checkArgument(maxAttempts >= 1, "maxAttempts must be a positive integer.");
        return builder -> builder.maxAttempts(maxAttempts);
    }

    /**
     * Sets the Clock used to take timestamps and to wait.
     *
     * @param clock The Clock.
     * @return The option.
     */
    public static RetryOption withClock(Clock clock) {
        Preconditions.checkNotNull(clock, "clock");
        return builder -> builder.clock(clock);
    }

    /**
     * Sets the classifier which decides whether a failure is retried.
     *
     * @param classifier The classifier.
     * @return The option.
     */
    public static RetryOption withRetryCheck(Predicate<Throwable> classifier) {
        Preconditions.checkNotNull(classifier, "classifier");
        return builder -> builder.classifier(classifier);
    }

    /**
     * Retries only the given failures. See {@link Classifiers#whitelist}.
     *
     * @param whitelist The failures to retry.
     * @return The option.
     */
    public static RetryOption withWhitelist(Throwable... whitelist) {
        return withRetryCheck(Classifiers.whitelist(whitelist));
    }

    /**
     * Retries all failures but the given ones. See {@link Classifiers#blacklist}.
     *
     * @param blacklist The failures not to retry.
     * @return The option.
     */
    public static RetryOption withBlacklist(Throwable... blacklist) {
        return withRetryCheck(Classifiers.blacklist(blacklist));
    }

    /**
     * Waits {@code factor^i} seconds after attempt {@code i}. See {@link WaitStrategies#exponential(double)}.
     *
     * @param factor The base of the exponent.
     * @return The option.
     */
    public static RetryOption withExpBackoff(double factor) {
        return withWaitStrategy(WaitStrategies.exponential(factor));
    }

    /**
     * Waits the given time after every failed attempt.
     *
     * @param delay The time to wait.
     * @return The option.
     */
    public static RetryOption withConstantBackoff(Duration delay) {
        return withWaitStrategy(WaitStrategies.constant(delay));
    }

    /**
     * Sets a custom WaitStrategy.
     *
     * @param waitStrategy The WaitStrategy.
     * @return The option.
     */
    public static RetryOption withWaitStrategy(WaitStrategy waitStrategy) {
        Preconditions.checkNotNull(waitStrategy, "waitStrategy");
        return builder -> builder.waitStrategy(waitStrategy);
    }

    /**
     * Applies the attempt count and backoff defined by the given RetryConfig.
     *
     * @param config The RetryConfig.
     * @return The option.
     */
    public static RetryOption withConfig(RetryConfig config) {
        Preconditions.checkNotNull(config, "config");
        return builder -> builder.apply(config.toOptions());
    }
}
