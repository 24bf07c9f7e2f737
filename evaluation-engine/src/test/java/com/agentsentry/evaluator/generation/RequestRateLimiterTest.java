package com.agentsentry.evaluator.generation;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.atomic.AtomicLong;

import static org.junit.jupiter.api.Assertions.*;

class RequestRateLimiterTest {

    private AtomicLong now;
    private RequestRateLimiter limiter;

    @BeforeEach
    void setUp() {
        now = new AtomicLong(1_000_000L);
        limiter = new RequestRateLimiter(10, now::get);
    }

    @Test
    void shouldAcquireWithinRateLimit() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.tryAcquire());
        }
        assertEquals(10, limiter.getCurrentWindowSize());
    }

    @Test
    void shouldBlockWhenRateLimitExceeded() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.tryAcquire());
        }
        assertFalse(limiter.tryAcquire());
    }

    @Test
    void shouldReleaseAfterWindowSlides() {
        for (int i = 0; i < 10; i++) {
            assertTrue(limiter.tryAcquire());
        }

        now.addAndGet(60_000L);

        assertTrue(limiter.tryAcquire());
        assertEquals(1, limiter.getCurrentWindowSize());
    }
}
