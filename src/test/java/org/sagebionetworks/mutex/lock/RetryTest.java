package org.sagebionetworks.mutex.lock;

import static org.testng.Assert.assertEquals;
import static org.testng.Assert.assertNotEquals;
import static org.testng.Assert.assertSame;

import java.time.Duration;

import org.testng.annotations.Test;

public class RetryTest {

    @Test
    public void testOf() {
        Retry retry = Retry.of(3, Duration.ofMillis(100));
        assertEquals(retry.getAttempts(), 3);
        assertEquals(retry.getInterval(), Duration.ofMillis(100));
    }

    @Test
    public void testOnce() {
        assertEquals(Retry.once().getAttempts(), 1);
        assertEquals(Retry.once().getInterval(), Duration.ZERO);
        assertSame(Retry.once(), Retry.once());
        assertEquals(Retry.of(1, Duration.ZERO), Retry.once());
    }

    @Test
    public void testEquals() {
        assertEquals(Retry.of(2, Duration.ofSeconds(1)), Retry.of(2, Duration.ofMillis(1000)));
        assertEquals(Retry.of(2, Duration.ofSeconds(1)).hashCode(), Retry.of(2, Duration.ofMillis(1000)).hashCode());
        assertNotEquals(Retry.of(2, Duration.ofSeconds(1)), Retry.of(3, Duration.ofSeconds(1)));
        assertNotEquals(Retry.of(2, Duration.ofSeconds(1)), Retry.of(2, Duration.ofSeconds(2)));
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testZeroAttempts() {
        Retry.of(0, Duration.ZERO);
    }

    @Test(expectedExceptions = IllegalArgumentException.class)
    public void testNegativeInterval() {
        Retry.of(2, Duration.ofMillis(-1));
    }

    @Test(expectedExceptions = NullPointerException.class)
    public void testNullInterval() {
        Retry.of(2, null);
    }
}
