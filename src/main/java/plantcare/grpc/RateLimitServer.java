package plantcare.grpc;

import io.grpc.Server;
import io.grpc.ServerBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import plantcare.engine.RateLimiterEngine;

import java.io.IOException;
import java.util.concurrent.TimeUnit;

/**
 * gRPC server exposing the process's rate limiter to sibling services.
 *
 * <p>Features:
 * <ul>
 *   <li>Configurable port (default: 9090, 0 picks a free port)</li>
 *   <li>Graceful shutdown with timeout</li>
 *   <li>Shares the engine instance used by the HTTP filter chain</li>
 * </ul>
 *
 * <p>Lifecycle is owned by the application context: {@link #start()} on
 * startup, {@link #stop()} on shutdown.
 */
public final class RateLimitServer {

    private static final Logger log = LoggerFactory.getLogger(RateLimitServer.class);

    public static final int DEFAULT_PORT = 9090;
    private static final int SHUTDOWN_TIMEOUT_SECONDS = 5;

    private final Server server;
    private volatile boolean started;

    /**
     * @param port Port to listen on
     * @param engine Rate limiter engine
     */
    public RateLimitServer(int port, RateLimiterEngine engine) {
        this.server = ServerBuilder.forPort(port)
            .addService(new RateLimitServiceImpl(engine))
            .build();
    }

    /**
     * @throws IOException if the server fails to bind
     */
    public void start() throws IOException {
        server.start();
        started = true;
        log.info("RateLimitServer started on port: {}", server.getPort());
    }

    /**
     * Stops the server gracefully, forcing shutdown after the timeout.
     *
     * @throws InterruptedException if shutdown is interrupted
     */
    public void stop() throws InterruptedException {
        if (!started) {
            return;
        }
        server.shutdown();
        if (!server.awaitTermination(SHUTDOWN_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
            log.warn("RateLimitServer did not stop within {}s, forcing shutdown", SHUTDOWN_TIMEOUT_SECONDS);
            server.shutdownNow();
        }
        started = false;
        log.info("RateLimitServer stopped.");
    }

    public boolean isServing() {
        return started && !server.isShutdown();
    }

    /**
     * @return port number, or -1 if not started
     */
    public int getPort() {
        return started ? server.getPort() : -1;
    }
}
