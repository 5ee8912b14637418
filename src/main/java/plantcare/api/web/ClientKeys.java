package plantcare.api.web;

import jakarta.servlet.http.HttpServletRequest;
import plantcare.core.model.RateLimiter;

/** Resolves the identity a caller's quota is tracked under. */
final class ClientKeys {

    private ClientKeys() {
    }

    /**
     * The socket's remote address, else "unknown".
     *
     * <p>Forwarding headers are never read here. Behind a trusted proxy the container rewrites
     * the remote address ({@code server.forward-headers-strategy}), so a caller cannot pick
     * its own key.
     */
    static String resolve(HttpServletRequest request) {
        String remote = request.getRemoteAddr();
        return remote == null || remote.isBlank() ? RateLimiter.UNKNOWN_CLIENT : remote;
    }
}
