package plantcare.engine;

import java.util.Set;

/**
 * Immutable rate limiting policy.
 *
 * @param maxCalls Requests allowed per client per window
 * @param windowSeconds Window length in seconds
 * @param exemptPaths Request paths that are never rate limited (e.g. health checks)
 * @param maxClients Maximum number of client windows tracked at once (LRU eviction beyond this)
 */
public record LimiterConfig(
    int maxCalls,
    int windowSeconds,
    Set<String> exemptPaths,
    int maxClients
) {
    public static final int DEFAULT_MAX_CALLS = 100;
    public static final int DEFAULT_WINDOW_SECONDS = 60;
    public static final int DEFAULT_MAX_CLIENTS = 10_000;
    public static final Set<String> DEFAULT_EXEMPT_PATHS = Set.of("/health", "/health/detailed");

    public LimiterConfig {
        if (maxCalls <= 0) throw new IllegalArgumentException("maxCalls must be > 0");
        if (windowSeconds <= 0) throw new IllegalArgumentException("windowSeconds must be > 0");
        if (maxClients <= 0) throw new IllegalArgumentException("maxClients must be > 0");
        if (exemptPaths == null) throw new IllegalArgumentException("exemptPaths cannot be null");

        exemptPaths = Set.copyOf(exemptPaths);
    }

    /**
     * Creates a configuration with the default exempt paths and client capacity.
     *
     * @param maxCalls Requests allowed per window
     * @param windowSeconds Window length in seconds
     * @return Configuration for a fixed window limiter
     */
    public static LimiterConfig of(int maxCalls, int windowSeconds) {
        return new LimiterConfig(maxCalls, windowSeconds, DEFAULT_EXEMPT_PATHS, DEFAULT_MAX_CLIENTS);
    }

    /**
     * 100 requests per 60 seconds, health checks exempt.
     */
    public static LimiterConfig defaults() {
        return of(DEFAULT_MAX_CALLS, DEFAULT_WINDOW_SECONDS);
    }

    public LimiterConfig withExemptPaths(Set<String> paths) {
        return new LimiterConfig(maxCalls, windowSeconds, paths, maxClients);
    }

    public LimiterConfig withMaxClients(int clients) {
        return new LimiterConfig(maxCalls, windowSeconds, exemptPaths, clients);
    }

    public long windowMillis() {
        return windowSeconds * 1000L;
    }

    public boolean isExempt(String path) {
        return path != null && exemptPaths.contains(path);
    }
}
