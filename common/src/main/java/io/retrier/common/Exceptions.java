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
package io.retrier.common;

import com.google.common.base.Preconditions;
import lombok.SneakyThrows;

/**
 * Argument checks and exception helpers.
 */
public final class Exceptions {

    private Exceptions() {
    }

    /**
     * Rethrows the given Throwable without wrapping it, even if it is a checked exception that the caller does not
     * declare. Used to hand the exact failure of an operation back to whoever runs it.
     * <pre>throw Exceptions.sneakyThrow(lastFailure);</pre>
     *
     * @param t The Throwable to rethrow.
     * @return Never returns; the return type only lets callers write {@code throw}.
     */
    @SneakyThrows
    public static RuntimeException sneakyThrow(Throwable t) {
        throw t;
    }

    /**
     * Throws a NullPointerException if the arg argument is null. Throws an IllegalArgumentException if the String arg
     * argument has a length of zero.
     *
     * @param arg     The argument to check.
     * @param argName The name of the argument (to be included in the exception message).
     * @return The arg.
     * @throws NullPointerException     If arg is null.
     * @throws IllegalArgumentException If arg is not null, but has a length of zero.
     */
    public static String checkNotNullOrEmpty(String arg, String argName) throws NullPointerException, IllegalArgumentException {
        Preconditions.checkNotNull(arg, argName);
        checkArgument(arg.length() > 0, argName, "Cannot be an empty string.");
        return arg;
    }

    /**
     * Throws an IllegalArgumentException if the validCondition argument is false.
     *
     * @param validCondition The result of the condition to validate.
     * @param argName        The name of the argument (to be included in the exception message).
     * @param message        The message to include in the exception. This should not include the name of the argument,
     *                       as that is already prefixed.
     * @param args           Format args for message. These must correspond to String.format() args.
     * @throws IllegalArgumentException If validCondition is false.
     */
    public static void checkArgument(boolean validCondition, String argName, String message, Object... args) throws IllegalArgumentException {
        if (!validCondition) {
            throw new IllegalArgumentException(badArgumentMessage(argName, message, args));
        }
    }

    private static String badArgumentMessage(String argName, String message, Object... args) {
        return argName + ": " + String.format(message, args);
    }
}
