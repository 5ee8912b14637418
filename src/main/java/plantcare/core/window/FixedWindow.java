package plantcare.core.window;

import plantcare.core.model.ClientWindow;
import plantcare.core.model.RateLimitResult;

/**
 * Fixed-window counter for a single client.
 *
 * <p>The window opens at the client's first request (it is not aligned to the
 * clock) and resets once {@code windowMillis} have elapsed since it opened.
 * Requests straddling a boundary can reach twice the nominal rate.
 *
 * <p>Not thread-safe: callers serialize access per client.
 */
public final class FixedWindow {
    private final long windowMillis;
    private final int limit;

    private long windowStart;
    private int count;

    public FixedWindow(long windowMillis, int limit, long nowMillis) {
        if (windowMillis <= 0) throw new IllegalArgumentException("window <= 0");
        if (limit <= 0) throw new IllegalArgumentException("limit <= 0");
        this.windowMillis = windowMillis;
        this.limit = limit;
        this.windowStart = nowMillis;
        this.count = 0;
    }

    public RateLimitResult tryAcquire(long now) {
        if (isExpired(now)) {
            windowStart = now;
            count = 0;
        }

        long reset = windowStart + windowMillis;
        if (count >= limit) {
            long elapsed = Math.max(0L, now - windowStart);
            return RateLimitResult.reject(limit, reset, windowMillis - elapsed);
        }

        count++;
        return RateLimitResult.admit(limit, limit - count, reset);
    }

    public boolean isExpired(long now) {
        return now - windowStart >= windowMillis;
    }

    public ClientWindow snapshot(String clientKey) {
        return new ClientWindow(clientKey, count, windowStart);
    }
}
