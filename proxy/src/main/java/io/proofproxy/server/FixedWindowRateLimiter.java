package io.proofproxy.server;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Counts requests per client in one-second windows.
 */
public class FixedWindowRateLimiter implements RateLimiter {
    private static final int PRUNE_THRESHOLD = 10_000;

    private final int limit;
    private final Clock clock;
    private final ConcurrentMap<String, Window> windows = new ConcurrentHashMap<>();

    public FixedWindowRateLimiter(int limit, Clock clock) {
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive (current: " + limit + ")");
        }
        this.limit = limit;
        this.clock = clock;
    }

    @Override
    public boolean tryAcquire(String clientKey) {
        long second = clock.millis() / 1000;
        if (windows.size() > PRUNE_THRESHOLD) {
            windows.values().removeIf(w -> w.second < second);
        }
        Window window = windows.compute(clientKey, (key, current) ->
                current == null || current.second != second ? new Window(second, 1) : new Window(second, current.count + 1));
        return window.count <= limit;
    }

    @Override
    public int getLimit() {
        return limit;
    }

    private static final class Window {
        private final long second;
        private final int count;

        private Window(long second, int count) {
            this.second = second;
            this.count = count;
        }
    }
}
