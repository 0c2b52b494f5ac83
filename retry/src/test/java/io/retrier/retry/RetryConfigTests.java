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

import io.retrier.common.util.ConfigurationException;
import io.retrier.test.common.AssertExtensions;
import io.retrier.test.common.IntentionalException;
import java.time.Duration;
import java.util.Collections;
import java.util.Properties;
import lombok.val;
import org.junit.Assert;
import org.junit.Test;

/**
 * Unit tests for the RetryConfig class.
 */
public class RetryConfigTests {
    /**
     * Tests the default values.
     */
    @Test
    public void testDefaults() {
        val c = RetryConfig.builder().build();
        Assert.assertEquals(RetryPolicy.DEFAULT_MAX_ATTEMPTS, c.getMaxAttempts());
        Assert.assertEquals(RetryConfig.Backoff.EXPONENTIAL, c.getBackoff());
        Assert.assertEquals(RetryPolicy.DEFAULT_BACKOFF_FACTOR, c.getBackoffFactor(), 0);
        Assert.assertEquals(Duration.ofSeconds(1), c.getConstantDelay());
        Assert.assertEquals(Duration.ZERO, c.getMaxDelay());

        val s = (DelayStrategy) c.createWaitStrategy();
        Assert.assertEquals(Duration.ofSeconds(1024), s.getDelay(10));
    }

    /**
     * Tests values given through the builder.
     */
    @Test
    public void testBuilder() {
        val c = RetryConfig.builder()
                .with(RetryConfig.MAX_ATTEMPTS, 7)
                .with(RetryConfig.BACKOFF_FACTOR, 3.0)
                .with(RetryConfig.MAX_DELAY_MILLIS, 10000L)
                .build();
        Assert.assertEquals(7, c.getMaxAttempts());
        val s = (DelayStrategy) c.createWaitStrategy();
        Assert.assertEquals(Duration.ofSeconds(9), s.getDelay(2));
        Assert.assertEquals(Duration.ofSeconds(10), s.getDelay(3));
    }

    /**
     * Tests reading from a Properties object, including a legacy property name and a lowercase enum value.
     */
    @Test
    public void testProperties() {
        val props = new Properties();
        props.setProperty("retry.attempts", "6");
        props.setProperty("retry.backoff", "constant");
        props.setProperty("retry.constantDelayMillis", "250");
        props.setProperty("other.maxAttempts", "1");
        val c = RetryConfig.builder().withProperties(props).build();
        Assert.assertEquals(6, c.getMaxAttempts());
        Assert.assertEquals(RetryConfig.Backoff.CONSTANT, c.getBackoff());

        val clock = new ManualClock();
        val result = Retrier.of(() -> {
            throw new IntentionalException();
        }, RetryOptions.withConfig(c), RetryOptions.withClock(clock)).run();
        Assert.assertTrue("Expected a failure.", result.isPresent());
        AssertExtensions.assertListEquals("Unexpected sleeps.", Collections.nCopies(5, Duration.ofMillis(250)), clock.getSleeps());
    }

    /**
     * Tests the NONE backoff.
     */
    @Test
    public void testNoBackoff() {
        val c = RetryConfig.builder().with(RetryConfig.BACKOFF, RetryConfig.Backoff.NONE).build();
        Assert.assertSame(WaitStrategies.none(), c.createWaitStrategy());
    }

    /**
     * Tests invalid values.
     */
    @Test
    public void testInvalidValues() {
        AssertExtensions.assertThrows("Zero attempts accepted.",
                () -> RetryConfig.builder().with(RetryConfig.MAX_ATTEMPTS, 0).build(),
                ex -> ex instanceof ConfigurationException && ex.getMessage().contains("retry.maxAttempts"));
        AssertExtensions.assertThrows(() -> RetryConfig.builder().with(RetryConfig.BACKOFF_FACTOR, -1.0).build(),
                ConfigurationException.class);
        AssertExtensions.assertThrows(() -> RetryConfig.builder().with(RetryConfig.CONSTANT_DELAY_MILLIS, -5L).build(),
                ConfigurationException.class);

        val props = new Properties();
        props.setProperty("retry.backoff", "sometimes");
        AssertExtensions.assertThrows(() -> RetryConfig.builder().withProperties(props).build(),
                ConfigurationException.class);
    }
}
