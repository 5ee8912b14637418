package plantcare.api.controller;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;
import plantcare.api.config.PlantCareProperties;
import plantcare.engine.PurgeScheduler;
import plantcare.engine.RateLimiterEngine;
import plantcare.grpc.RateLimitServer;

/**
 * Liveness and dependency health endpoints, plus the API root.
 *
 * <p>{@code /health} and {@code /health/detailed} are exempt from rate limiting by default.
 */
@RestController
public class HealthController {
    static final String SERVICE_NAME = "plant-care-api";

    private final PlantCareProperties properties;
    private final RateLimiterEngine engine;
    private final PurgeScheduler purgeScheduler;
    private final ObjectProvider<RateLimitServer> grpcServer;

    public HealthController(
        PlantCareProperties properties,
        RateLimiterEngine engine,
        PurgeScheduler purgeScheduler,
        ObjectProvider<RateLimitServer> grpcServer) {
        this.properties = properties;
        this.engine = engine;
        this.purgeScheduler = purgeScheduler;
        this.grpcServer = grpcServer;
    }

    @GetMapping("/")
    public Map<String, Object> root() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Welcome to Plant Care API");
        body.put("version", properties.getVersion());
        body.put("docs", "/docs");
        body.put("health", "/health");
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("service", SERVICE_NAME);
        body.put("version", properties.getVersion());
        return body;
    }

    /**
     * Reports each in-process component. Answers 503 when a required one is down.
     */
    @GetMapping("/health/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        Map<String, Object> dependencies = new LinkedHashMap<>();
        boolean healthy = true;

        Map<String, Object> limiter = new LinkedHashMap<>();
        limiter.put("status", "healthy");
        limiter.put("tracked_clients", engine.trackedClients());
        limiter.put("max_clients", engine.maxClients());
        limiter.put("max_calls", engine.getConfig().maxCalls());
        limiter.put("window_seconds", engine.getConfig().windowSeconds());
        dependencies.put("rate_limiter", limiter);

        Map<String, Object> housekeeping = new LinkedHashMap<>();
        boolean purgeRunning = purgeScheduler.isRunning();
        healthy &= purgeRunning;
        housekeeping.put("status", purgeRunning ? "healthy" : "unhealthy");
        housekeeping.put("interval_seconds", purgeScheduler.intervalSeconds());
        Instant lastRun = purgeScheduler.lastRun();
        housekeeping.put("last_run", lastRun == null ? null : lastRun.toString());
        housekeeping.put("last_removed", purgeScheduler.lastRemoved());
        dependencies.put("housekeeping", housekeeping);

        Map<String, Object> grpc = new LinkedHashMap<>();
        RateLimitServer server = grpcServer.getIfAvailable();
        if (server == null) {
            grpc.put("status", "disabled");
        } else if (server.isServing()) {
            grpc.put("status", "healthy");
            grpc.put("port", server.getPort());
        } else {
            healthy = false;
            grpc.put("status", "unhealthy");
        }
        dependencies.put("grpc", grpc);

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", healthy ? "healthy" : "unhealthy");
        body.put("service", SERVICE_NAME);
        body.put("version", properties.getVersion());
        body.put("environment", properties.getEnvironment());
        body.put("dependencies", dependencies);
        body.put("timestamp", Instant.ofEpochMilli(engine.getClock().nowMillis()).toString());

        return ResponseEntity.status(healthy ? HttpStatus.OK : HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }
}
