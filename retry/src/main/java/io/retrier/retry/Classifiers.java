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
import com.google.common.base.Throwables;
import com.google.common.collect.ImmutableList;
import java.util.List;
import java.util.function.Predicate;

/**
 * Factory methods for classifiers: predicates that decide whether a failure may be retried.
 * <p>
 * Several of these look at the failure's cause chain: the failure itself, followed by what is obtained by repeatedly
 * calling {@link Throwable#getCause()} until no further cause exists. A cause chain that loops back on itself makes
 * them throw an {@link IllegalArgumentException}.
 */
public final class Classifiers {
    private static final Predicate<Throwable> RETRY_ON_ALL = failure -> failure != null;

    private Classifiers() {
    }

    /**
     * Retries on every failure. This is the default classifier.
     *
     * @return The classifier.
     */
    public static Predicate<Throwable> retryOnAll() {
        return RETRY_ON_ALL;
    }

    /**
     * Retries only on failures that match one of the given entries. A failure matches an entry if either:
     * <ul>
     * <li>the entry is part of the failure's cause chain (by identity or {@code equals}), or
     * <li>the message of any element of the failure's cause chain contains the entry's message.
     * </ul>
     * Entries with a null message only match the first way, while an entry with an empty message matches every failure
     * that has a message. An empty whitelist never retries.
     *
     * @param whitelist The failures to retry on.
     * @return The classifier.
     */
    public static Predicate<Throwable> whitelist(Throwable... whitelist) {
        List<Throwable> entries = ImmutableList.copyOf(whitelist);
        return failure -> {
            if (failure == null) {
                return false;
            }

            List<Throwable> chain = Throwables.getCausalChain(failure);
            for (Throwable entry : entries) {
                if (isEquivalent(chain, entry) || matchesMessage(chain, entry)) {
                    return true;
                }
            }
            return false;
        };
    }

    /**
     * Retries on all failures, except those for which one of the given entries is part of the cause chain (by identity
     * or {@code equals}). Messages are not compared. An empty blacklist always retries.
     *
     * @param blacklist The failures not to retry on.
     * @return The classifier.
     */
    public static Predicate<Throwable> blacklist(Throwable... blacklist) {
        List<Throwable> entries = ImmutableList.copyOf(blacklist);
        return failure -> {
            if (failure == null) {
                return false;
            }

            List<Throwable> chain = Throwables.getCausalChain(failure);
            return entries.stream().noneMatch(entry -> isEquivalent(chain, entry));
        };
    }

    /**
     * Retries only on failures whose cause chain contains an instance of one of the given types.
     *
     * @param types The types of failures to retry on.
     * @return The classifier.
     */
    @SafeVarargs
    public static Predicate<Throwable> retryingOn(Class<? extends Throwable>... types) {
        List<Class<? extends Throwable>> entries = ImmutableList.copyOf(types);
        Preconditions.checkArgument(!entries.isEmpty(), "At least one type is required.");
        return failure -> failure != null
                && Throwables.getCausalChain(failure).stream()
                             .anyMatch(cause -> entries.stream().anyMatch(type -> type.isInstance(cause)));
    }

    private static boolean isEquivalent(List<Throwable> chain, Throwable entry) {
        for (Throwable cause : chain) {
            if (cause == entry || cause.equals(entry)) {
                return true;
            }
        }
        return false;
    }

    private static boolean matchesMessage(List<Throwable> chain, Throwable entry) {
        String expected = entry.getMessage();
        if (expected == null) {
            return false;
        }

        // Substring matching also covers an exact match; an empty message is contained in any message.
        for (Throwable cause : chain) {
            String actual = cause.getMessage();
            if (actual != null && actual.contains(expected)) {
                return true;
            }
        }
        return false;
    }
}
