package plantcare.core.clock;

/**
 * Time source for the limiter. Values are wall-clock epoch milliseconds so that
 * window resets can be reported to HTTP clients as absolute timestamps.
 */
public interface Clock {
    long nowMillis();
}
