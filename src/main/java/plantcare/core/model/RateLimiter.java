package plantcare.core.model;

/**
 * Core contract: pure in-memory decisions, no I/O.
 *
 * Implementations must be total: every call returns a result, whatever the key
 * or path. A null or blank key is tracked under {@link #UNKNOWN_CLIENT}.
 */
public interface RateLimiter {

    String UNKNOWN_CLIENT = "unknown";

    RateLimitResult check(String clientKey, String path, long nowMillis);

    /**
     * Drops every client window that has aged past the configured period.
     *
     * @return number of windows removed
     */
    int purge(long nowMillis);
}
