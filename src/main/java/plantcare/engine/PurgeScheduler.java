package plantcare.engine;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Periodically sweeps expired client windows out of a {@link RateLimiterEngine}.
 *
 * <p>Runs on a single daemon thread. A failed sweep is logged and the next one
 * still runs.
 */
public final class PurgeScheduler {

    private static final Logger log = LoggerFactory.getLogger(PurgeScheduler.class);
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final RateLimiterEngine engine;
    private final long intervalSeconds;
    private final AtomicLong lastRunMillis = new AtomicLong(-1L);
    private final AtomicLong lastRemoved = new AtomicLong(0L);
    private final AtomicLong totalRemoved = new AtomicLong(0L);

    private ScheduledExecutorService executor;

    /**
     * @param engine Engine to sweep
     * @param intervalSeconds Delay between sweeps (must be > 0)
     */
    public PurgeScheduler(RateLimiterEngine engine, long intervalSeconds) {
        if (engine == null) {
            throw new IllegalArgumentException("engine cannot be null");
        }
        if (intervalSeconds <= 0) {
            throw new IllegalArgumentException("intervalSeconds must be > 0");
        }
        this.engine = engine;
        this.intervalSeconds = intervalSeconds;
    }

    public synchronized void start() {
        if (executor != null) {
            return;
        }
        executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            Thread thread = new Thread(runnable, "rate-limit-purge");
            thread.setDaemon(true);
            return thread;
        });
        executor.scheduleWithFixedDelay(this::runOnce, intervalSeconds, intervalSeconds, TimeUnit.SECONDS);
        log.info("Rate limit purge scheduled every {}s", intervalSeconds);
    }

    /**
     * Runs one sweep on the calling thread.
     *
     * @return Number of windows removed, or 0 if the sweep failed
     */
    public int runOnce() {
        try {
            long now = engine.getClock().nowMillis();
            int removed = engine.purge(now);
            lastRunMillis.set(now);
            lastRemoved.set(removed);
            totalRemoved.addAndGet(removed);
            log.debug("Rate limit purge removed {} windows, {} tracked", removed, engine.trackedClients());
            return removed;
        } catch (RuntimeException e) {
            // Escaping would cancel every later run
            log.warn("Rate limit purge failed", e);
            return 0;
        }
    }

    public synchronized void stop() throws InterruptedException {
        if (executor == null) {
            return;
        }
        executor.shutdown();
        if (!executor.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            executor.shutdownNow();
        }
        executor = null;
        log.info("Rate limit purge stopped");
    }

    public synchronized boolean isRunning() {
        return executor != null && !executor.isShutdown();
    }

    /**
     * @return Time of the last completed sweep, or null if none has run
     */
    public Instant lastRun() {
        long millis = lastRunMillis.get();
        return millis < 0 ? null : Instant.ofEpochMilli(millis);
    }

    public long lastRemoved() {
        return lastRemoved.get();
    }

    public long totalRemoved() {
        return totalRemoved.get();
    }

    public long intervalSeconds() {
        return intervalSeconds;
    }
}
