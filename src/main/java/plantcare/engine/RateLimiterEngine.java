package plantcare.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plantcare.core.clock.Clock;
import plantcare.core.model.ClientWindow;
import plantcare.core.model.RateLimitResult;
import plantcare.core.model.RateLimiter;
import plantcare.core.window.FixedWindow;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Thread-safe per-client fixed window rate limiter.
 *
 * Architecture:
 * - LRUCache stores LimiterEntry (FixedWindow + ReentrantLock) per client key
 * - Per-client locks: requests from different clients never wait on each other,
 *   only on the short synchronized cache lookup
 * - Clock injection enables deterministic testing
 * - LRU bound (maxClients) plus {@link #purge(long)} keep memory bounded when clients churn
 *
 * Thread-safety:
 * - check() performs its read-modify-write under the client's lock, so concurrent
 *   requests from one client never lose an update
 * - purge() and LRU eviction retire an entry under its client lock; a check that
 *   raced with the removal sees the flag and retries on a fresh entry
 * - Lock order is always cache lock, then entry lock: eviction locks the entry
 *   from inside the cache, so no cache call is made while an entry lock is held
 *
 * Usage example:
 * <pre>
 * RateLimiterEngine engine = new RateLimiterEngine(SystemClock.instance(), LimiterConfig.defaults());
 *
 * RateLimitResult result = engine.check("203.0.113.7", "/api/v1/plants");
 * if (result.admitted()) {
 *     // Process request
 * } else {
 *     // 429 with Retry-After: result.retryAfterHeaderSeconds()
 * }
 * </pre>
 */
public final class RateLimiterEngine implements RateLimiter {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterEngine.class);

    private final Clock clock;
    private final LimiterConfig config;
    private final LRUCache<String, LimiterEntry> windows;

    /**
     * Creates a new rate limiter engine.
     *
     * @param clock Clock instance for time control (injected for testability)
     * @param config Limiter policy
     * @throws IllegalArgumentException if any parameter is null
     */
    public RateLimiterEngine(Clock clock, LimiterConfig config) {
        if (clock == null) {
            throw new IllegalArgumentException("clock cannot be null");
        }
        if (config == null) {
            throw new IllegalArgumentException("config cannot be null");
        }

        this.clock = clock;
        this.config = config;
        this.windows = new LRUCache<>(config.maxClients(), RateLimiterEngine::retireEvicted);
    }

    private static void retireEvicted(String key, LimiterEntry entry) {
        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            entry.retire();
        } finally {
            lock.unlock();
        }
        log.debug("Evicted least recently used client window: {}", key);
    }

    /**
     * Checks a request against the client's quota using the engine clock.
     *
     * @see #check(String, String, long)
     */
    public RateLimitResult check(String clientKey, String path) {
        return check(clientKey, path, clock.nowMillis());
    }

    /**
     * Admits or rejects one request.
     *
     * Exempt paths are admitted without touching any state. Otherwise the
     * client's window is created on first sight, reset once the period has
     * elapsed, and counted under the client's lock.
     *
     * @param clientKey Caller identity; null or blank is tracked as "unknown"
     * @param path Logical route of the request
     * @param nowMillis Current time in epoch milliseconds
     * @return Never null
     */
    @Override
    public RateLimitResult check(String clientKey, String path, long nowMillis) {
        if (config.isExempt(path)) {
            return RateLimitResult.exemptAdmit();
        }

        String key = normalize(clientKey);
        while (true) {
            LimiterEntry entry = getOrCreateWindow(key, nowMillis);

            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (!entry.isRetired()) {
                    return entry.getWindow().tryAcquire(nowMillis);
                }
            } finally {
                lock.unlock();
            }
            // Purged or evicted between lookup and lock; drop it if a purge has not yet
            windows.remove(key, entry);
        }
    }

    public int purge() {
        return purge(clock.nowMillis());
    }

    /**
     * Removes windows whose period has fully elapsed.
     *
     * The scan works on a snapshot so the cache lock is only held while copying.
     * Each candidate is re-checked and retired under its own lock, then removed
     * from the cache after that lock is released.
     *
     * @param nowMillis Current time in epoch milliseconds
     * @return Number of windows removed
     */
    @Override
    public int purge(long nowMillis) {
        List<Map.Entry<String, LimiterEntry>> candidates = windows.snapshot();
        int removed = 0;

        for (Map.Entry<String, LimiterEntry> candidate : candidates) {
            LimiterEntry entry = candidate.getValue();
            ReentrantLock lock = entry.getLock();
            lock.lock();
            try {
                if (entry.isRetired() || !entry.getWindow().isExpired(nowMillis)) {
                    continue;
                }
                entry.retire();
            } finally {
                lock.unlock();
            }
            if (windows.remove(candidate.getKey(), entry)) {
                removed++;
            }
        }

        if (removed > 0) {
            log.debug("Purged {} expired client windows, {} remain", removed, windows.size());
        }
        return removed;
    }

    /**
     * Returns a snapshot of a client's current window, if one is tracked.
     *
     * @param clientKey Caller identity; null or blank means "unknown"
     * @return The window state, or empty if the client has none
     */
    public Optional<ClientWindow> window(String clientKey) {
        String key = normalize(clientKey);
        LimiterEntry entry = windows.get(key);
        if (entry == null) {
            return Optional.empty();
        }

        ReentrantLock lock = entry.getLock();
        lock.lock();
        try {
            if (entry.isRetired()) {
                return Optional.empty();
            }
            return Optional.of(entry.getWindow().snapshot(key));
        } finally {
            lock.unlock();
        }
    }

    /**
     * Retrieves or creates the window entry for a client.
     *
     * putIfAbsent ensures only one entry (and therefore one lock) exists per key.
     */
    private LimiterEntry getOrCreateWindow(String key, long nowMillis) {
        LimiterEntry entry = windows.get(key);
        if (entry != null) {
            return entry;
        }

        LimiterEntry newEntry = new LimiterEntry(
            new FixedWindow(config.windowMillis(), config.maxCalls(), nowMillis)
        );
        LimiterEntry existing = windows.putIfAbsent(key, newEntry);
        return (existing != null) ? existing : newEntry;
    }

    private static String normalize(String clientKey) {
        if (clientKey == null || clientKey.isBlank()) {
            return UNKNOWN_CLIENT;
        }
        return clientKey;
    }

    /**
     * Returns the number of currently tracked clients.
     */
    public int trackedClients() {
        return windows.size();
    }

    public int maxClients() {
        return windows.maxSize();
    }

    /**
     * Clears all client windows.
     * This is primarily useful for testing.
     */
    public void clear() {
        windows.clear();
    }

    public LimiterConfig getConfig() {
        return config;
    }

    public Clock getClock() {
        return clock;
    }
}
