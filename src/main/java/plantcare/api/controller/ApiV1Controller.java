package plantcare.api.controller;

import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import plantcare.api.config.PlantCareProperties;
import plantcare.engine.RateLimiterEngine;

/** Version 1 API routes: the index of feature areas and a rate limited health check. */
@RestController
@RequestMapping("/api/v1")
public class ApiV1Controller {
    private final PlantCareProperties properties;
    private final RateLimiterEngine engine;

    public ApiV1Controller(PlantCareProperties properties, RateLimiterEngine engine) {
        this.properties = properties;
        this.engine = engine;
    }

    @GetMapping({"", "/"})
    public Map<String, Object> index() {
        Map<String, String> endpoints = new LinkedHashMap<>();
        endpoints.put("authentication", "/api/v1/auth");
        endpoints.put("users", "/api/v1/users");
        endpoints.put("plants", "/api/v1/plants");
        endpoints.put("care", "/api/v1/care");
        endpoints.put("health", "/api/v1/plant-health");
        endpoints.put("growth", "/api/v1/growth");
        endpoints.put("community", "/api/v1/community");
        endpoints.put("ai", "/api/v1/ai");
        endpoints.put("weather", "/api/v1/weather");
        endpoints.put("analytics", "/api/v1/analytics");
        endpoints.put("notifications", "/api/v1/notifications");
        endpoints.put("payments", "/api/v1/payments");
        endpoints.put("content", "/api/v1/content");
        endpoints.put("admin", "/api/v1/admin");

        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Plant Care API v1");
        body.put("version", properties.getVersion());
        body.put("documentation", "/docs");
        body.put("health", "/api/v1/health");
        body.put("endpoints", endpoints);
        return body;
    }

    @GetMapping("/health")
    public Map<String, Object> health() {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "healthy");
        body.put("version", properties.getVersion());
        body.put("api_version", "v1");
        body.put("dependencies", Map.of(
            "rate_limiter", Map.of("status", "healthy", "tracked_clients", engine.trackedClients())));
        return body;
    }
}
