package plantcare.core.model;

/**
 * Read-only snapshot of one client's quota state.
 *
 * @param clientKey identity the quota is tracked under
 * @param count requests admitted in the current window
 * @param windowStartMillis epoch millis at which the current window began
 */
public record ClientWindow(
    String clientKey,
    int count,
    long windowStartMillis
) {
}
