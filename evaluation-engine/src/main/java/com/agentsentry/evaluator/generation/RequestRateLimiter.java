package com.agentsentry.evaluator.generation;

import java.util.concurrent.ConcurrentLinkedDeque;
import java.util.function.LongSupplier;

/**
 * Sliding one-minute window limiting calls to the text-generation backend.
 *
 * @author Naveed Gung
 */
public class RequestRateLimiter {

    private static final long WINDOW_MS = 60_000L;

    private final int limitPerMinute;
    private final LongSupplier clock;

    /** Timestamps of granted requests within the current window. */
    private final ConcurrentLinkedDeque<Long> grants = new ConcurrentLinkedDeque<>();

    public RequestRateLimiter(int limitPerMinute) {
        this(limitPerMinute, System::currentTimeMillis);
    }

    RequestRateLimiter(int limitPerMinute, LongSupplier clock) {
        this.limitPerMinute = limitPerMinute;
        this.clock = clock;
    }

    /**
     * Attempt to acquire a request token.
     *
     * @return true if the request is allowed under the limit
     */
    public synchronized boolean tryAcquire() {
        long now = clock.getAsLong();
        long windowStart = now - WINDOW_MS;

        while (!grants.isEmpty()) {
            Long oldest = grants.peekFirst();
            if (oldest != null && oldest <= windowStart) {
                grants.pollFirst();
            } else {
                break;
            }
        }

        if (grants.size() >= limitPerMinute) {
            return false;
        }

        grants.addLast(now);
        return true;
    }

    /** Requests granted in the last 60 seconds. */
    public int getCurrentWindowSize() {
        long windowStart = clock.getAsLong() - WINDOW_MS;
        return (int) grants.stream().filter(ts -> ts > windowStart).count();
    }
}
