package com.reactivechat.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JitterBackoffTest {

    @Test
    void testExponentialWithoutJitter() {
        Duration base = Duration.ofMillis(100);
        Duration max = Duration.ofSeconds(10);

        assertEquals(100, JitterBackoff.next(0, base, max, Duration.ZERO).toMillis());
        assertEquals(200, JitterBackoff.next(1, base, max, Duration.ZERO).toMillis());
        assertEquals(800, JitterBackoff.next(3, base, max, Duration.ZERO).toMillis());
    }

    @Test
    void testCappedAtMax() {
        Duration delay = JitterBackoff.next(30, Duration.ofMillis(100), Duration.ofSeconds(2), Duration.ZERO);

        assertEquals(2000, delay.toMillis());
    }

    @Test
    void testJitterWithinBounds() {
        for (int i = 0; i < 100; i++) {
            long millis = JitterBackoff.next(0).toMillis();
            assertTrue(millis >= 1000 && millis <= 6000, "got " + millis);
        }
    }
}
