// SPDX-FileCopyrightText: 2019-2022 Matus Faro <matus@smotana.com>
// SPDX-License-Identifier: Apache-2.0
package io.dataspray.dynamomigrator;

import com.google.common.collect.Lists;
import org.junit.Test;

import java.time.Duration;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class ExponentialBackoffTest {

    @Test(timeout = 5_000L)
    public void testDelayBoundDoublesUpToMax() throws Exception {
        ExponentialBackoff backoff = ExponentialBackoff.builder()
                .baseDelay(Duration.ofMillis(100))
                .maxDelay(Duration.ofMillis(1_000))
                .build();

        assertEquals(Duration.ofMillis(100), backoff.delayBound(1));
        assertEquals(Duration.ofMillis(200), backoff.delayBound(2));
        assertEquals(Duration.ofMillis(400), backoff.delayBound(3));
        assertEquals(Duration.ofMillis(800), backoff.delayBound(4));
        assertEquals(Duration.ofMillis(1_000), backoff.delayBound(5));
        assertEquals(Duration.ofMillis(1_000), backoff.delayBound(10_000));
    }

    @Test(timeout = 5_000L)
    public void testPauseSleepsJitteredDelayWithinBound() throws Exception {
        List<Duration> sleeps = Lists.newArrayList();
        ExponentialBackoff backoff = ExponentialBackoff.builder()
                .baseDelay(Duration.ofMillis(50))
                .sleeper(sleeps::add)
                .build();

        for (int i = 0; i < 100; i++) {
            Duration slept = backoff.pause(3);
            assertTrue(slept.compareTo(Duration.ZERO) >= 0);
            assertTrue(slept.compareTo(Duration.ofMillis(200)) <= 0);
        }
        assertEquals(100, sleeps.size());
    }

    @Test(timeout = 5_000L)
    public void testZeroBaseDelayNeverSleeps() throws Exception {
        List<Duration> sleeps = Lists.newArrayList();
        ExponentialBackoff backoff = ExponentialBackoff.builder()
                .baseDelay(Duration.ZERO)
                .sleeper(sleeps::add)
                .build();

        assertEquals(Duration.ZERO, backoff.pause(7));
        assertEquals(Duration.ZERO, sleeps.get(0));
    }

    @Test(timeout = 5_000L)
    public void testRetryLimit() throws Exception {
        ExponentialBackoff backoff = ExponentialBackoff.builder()
                .maxRetries(3)
                .build();

        assertTrue(backoff.canRetry(1));
        assertTrue(backoff.canRetry(3));
        assertFalse(backoff.canRetry(4));
        assertEquals(ExponentialBackoff.DEFAULT_MAX_RETRIES, ExponentialBackoff.defaults().getMaxRetries());
    }

    @Test(timeout = 5_000L)
    public void testInvalidSettings() throws Exception {
        try {
            ExponentialBackoff.builder().baseDelay(Duration.ofMillis(-1)).build();
            fail("Expected negative delay to be rejected");
        } catch (IllegalArgumentException ex) {
            // Expected
        }
        try {
            ExponentialBackoff.builder().maxRetries(-1).build();
            fail("Expected negative retries to be rejected");
        } catch (IllegalArgumentException ex) {
            // Expected
        }
    }
}
