package plantcare.engine;

import plantcare.core.window.FixedWindow;

import java.util.concurrent.locks.ReentrantLock;

/**
 * Entry holding one client's FixedWindow with its associated lock.
 *
 * Thread-safety:
 * - The lock must be acquired before touching the window or the retired flag
 * - Once retired (removed by a purge or LRU eviction) an entry is never reused; callers holding
 *   a stale reference look the client up again
 */
final class LimiterEntry {

    private final FixedWindow window;
    private final ReentrantLock lock;
    private boolean retired;

    LimiterEntry(FixedWindow window) {
        if (window == null) {
            throw new IllegalArgumentException("window cannot be null");
        }
        this.window = window;
        this.lock = new ReentrantLock(); // Non-fair for better throughput
    }

    /**
     * MUST be called while holding the lock.
     */
    FixedWindow getWindow() {
        return window;
    }

    ReentrantLock getLock() {
        return lock;
    }

    /**
     * MUST be called while holding the lock.
     */
    boolean isRetired() {
        return retired;
    }

    /**
     * MUST be called while holding the lock.
     */
    void retire() {
        retired = true;
    }
}
