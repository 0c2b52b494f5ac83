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
package io.retrier.test.common;

import java.util.List;
import java.util.function.Predicate;
import org.junit.Assert;

/**
 * Additional Assert methods that are useful during testing.
 */
public class AssertExtensions {

    /**
     * Asserts that a function throws an expected exception.
     *
     * @param message  The message to include in the Assert calls.
     * @param runnable The function to test.
     * @param tester   A predicate that indicates whether the exception (if thrown) is as expected.
     */
    public static void assertThrows(String message, RunnableWithException runnable, Predicate<Throwable> tester) {
        try {
            runnable.run();
        } catch (Exception ex) {
            if (!tester.test(ex)) {
                Assert.fail(message + " Exception thrown was of unexpected type: " + ex);
            }
            return;
        }

        Assert.fail(message + " No exception has been thrown.");
    }

    /**
     * Asserts that a function throws an exception of the given type.
     *
     * @param runnable The function to test.
     * @param type     The expected exception type.
     */
    public static void assertThrows(RunnableWithException runnable, Class<? extends Exception> type) {
        assertThrows("", runnable, type::isInstance);
    }

    /**
     * Asserts that the given lists contain the same elements, in the same order.
     *
     * @param message  The message to include in the Assert calls.
     * @param expected The expected list.
     * @param actual   The actual list.
     * @param <T>      The type of the list elements.
     */
    public static <T> void assertListEquals(String message, List<T> expected, List<T> actual) {
        Assert.assertEquals(message + " Sizes differ. Expected " + expected + ", actual " + actual + ".", expected.size(), actual.size());
        for (int i = 0; i < expected.size(); i++) {
            Assert.assertEquals(message + " Elements differ at index " + i + ".", expected.get(i), actual.get(i));
        }
    }

    @FunctionalInterface
    public interface RunnableWithException {
        void run() throws Exception;
    }
}
