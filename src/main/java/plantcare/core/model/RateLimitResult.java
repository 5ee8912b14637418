package plantcare.core.model;

/**
 * Outcome of a single rate limit check.
 *
 * <p>Exempt results carry no quota metadata: {@code limit}, {@code remaining},
 * {@code resetEpochMillis} and {@code retryAfterMillis} are all zero and
 * {@link #hasQuota()} returns false.
 */
public record RateLimitResult(
    Decision decision,
    int limit,
    int remaining,
    long resetEpochMillis,
    long retryAfterMillis,
    boolean exempt
) {
    private static final RateLimitResult EXEMPT =
        new RateLimitResult(Decision.ADMIT, 0, 0, 0L, 0L, true);

    public static RateLimitResult exemptAdmit() {
        return EXEMPT;
    }

    public static RateLimitResult admit(int limit, int remaining, long resetEpochMillis) {
        return new RateLimitResult(Decision.ADMIT, limit, Math.max(0, remaining), resetEpochMillis, 0L, false);
    }

    public static RateLimitResult reject(int limit, long resetEpochMillis, long retryAfterMillis) {
        return new RateLimitResult(Decision.REJECT, limit, 0, resetEpochMillis, Math.max(0L, retryAfterMillis), false);
    }

    public boolean admitted() {
        return decision == Decision.ADMIT;
    }

    public boolean hasQuota() {
        return !exempt;
    }

    /** Window reset as whole epoch seconds, as sent in {@code X-RateLimit-Reset}. */
    public long resetEpochSeconds() {
        return resetEpochMillis / 1000L;
    }

    /** Exact retry hint in (fractional) seconds. */
    public double retryAfterSeconds() {
        return retryAfterMillis / 1000.0;
    }

    /** Retry hint rounded up to whole seconds, as sent in {@code Retry-After}. */
    public long retryAfterHeaderSeconds() {
        return (retryAfterMillis + 999L) / 1000L;
    }
}
