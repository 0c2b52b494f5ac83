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
import java.time.Instant;
import java.util.Optional;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

/**
 * Runs an operation, re-running it after failures according to a {@link RetryPolicy}.
 * <p>
 * {@code
 * Optional<Exception> failure = Retrier.of(() -> store.write(entry),
 *         RetryOptions.withMaxAttempts(5),
 *         RetryOptions.withConstantBackoff(Duration.ofMillis(100)))
 *         .run();
 * }
 * <p>
 * The operation is attempted up to {@link RetryPolicy#getMaxAttempts()} times. After every failed attempt but the last
 * one, the policy's classifier decides whether the failure may be retried: if it may, the policy's WaitStrategy waits
 * before the next attempt begins; if not, the run ends right away. Failures are never wrapped: the last one is returned
 * (or, for {@link #runOrThrow()}, thrown) exactly as the operation raised it. Errors which are not Exceptions are not
 * considered failures and are not caught.
 * <p>
 * Attempts run sequentially on the calling thread. An instance may be run more than once, but not concurrently.
 */
@Slf4j
public final class Retrier {
    private final AttemptOperation operation;
    @Getter
    private final RetryPolicy policy;

    private Retrier(AttemptOperation operation, RetryPolicy policy) {
        this.operation = Preconditions.checkNotNull(operation, "operation");
        this.policy = Preconditions.checkNotNull(policy, "policy");
    }

    /**
     * Creates a new Retrier for the given Operation.
     *
     * @param operation The Operation to run.
     * @param options   RetryOptions to apply, in order, on top of the default policy.
     * @return A new Retrier.
     * @throws NullPointerException If operation is null.
     */
    public static Retrier of(Operation operation, RetryOption... options) {
        Preconditions.checkNotNull(operation, "operation");
        return new Retrier(operation.asAttemptOperation(), RetryPolicy.builder().apply(options).build());
    }

    /**
     * Creates a new Retrier for the given AttemptOperation.
     *
     * @param operation The AttemptOperation to run.
     * @param options   RetryOptions to apply, in order, on top of the default policy.
     * @return A new Retrier.
     * @throws NullPointerException If operation is null.
     */
    public static Retrier ofAttempt(AttemptOperation operation, RetryOption... options) {
        Preconditions.checkNotNull(operation, "operation");
        return new Retrier(operation, RetryPolicy.builder().apply(options).build());
    }

    /**
     * Creates a new Retrier for the given AttemptOperation and RetryPolicy.
     *
     * @param operation The AttemptOperation to run.
     * @param policy    The RetryPolicy to follow.
     * @return A new Retrier.
     * @throws NullPointerException If operation or policy is null.
     */
    public static Retrier create(AttemptOperation operation, RetryPolicy policy) {
        return new Retrier(operation, policy);
    }

    /**
     * Runs the operation until it succeeds, its failure is not retryable or all attempts are used up.
     *
     * @return An empty Optional if an attempt succeeded, otherwise the failure of the last attempt.
     */
    public Optional<Exception> run() {
        final int maxAttempts = this.policy.getMaxAttempts();
        final Clock clock = this.policy.getClock();
        Instant previousAttemptStart = null;
        Exception last = null;
        for (int index = 0; index < maxAttempts; index++) {
            Instant attemptStart = clock.now();
            try {
                this.operation.run(new Attempt(index, previousAttemptStart));
                log.trace("Attempt #{} succeeded.", index);
                return Optional.empty();
            } catch (Exception ex) {
                if (ex instanceof InterruptedException) {
                    Thread.currentThread().interrupt();
                }
                last = ex;
            }

            previousAttemptStart = attemptStart;
            if (index == maxAttempts - 1) {
                // No attempt follows, so there is nothing to classify or wait for.
                log.debug("Giving up after {} attempt(s). Last failure: \"{}\".", maxAttempts, last.toString());
                break;
            }

            if (!this.policy.getClassifier().test(last)) {
                log.debug("Not retrying after attempt #{}: \"{}\" is not retryable.", index, last.toString());
                break;
            }

            log.debug("Retrying after attempt #{} due to \"{}\". WaitStrategy = {}.", index, last.getMessage(), this.policy.getWaitStrategy());
            this.policy.getWaitStrategy().await(index, clock);
        }

        return Optional.ofNullable(last);
    }

    /**
     * Same as {@link #run()}, but throws the failure of the last attempt instead of returning it. The exact instance
     * raised by the operation is thrown, even if it is a checked exception.
     */
    public void runOrThrow() {
        Optional<Exception> failure = run();
        if (failure.isPresent()) {
            throw Exceptions.sneakyThrow(failure.get());
        }
    }

    @Override
    public String toString() {
        return String.format("Retrier(%s)", this.policy);
    }
}
