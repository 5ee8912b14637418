package plantcare.api.controller;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.options;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.header;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.request.RequestPostProcessor;
import plantcare.engine.RateLimiterEngine;

@SpringBootTest
@AutoConfigureMockMvc
class HealthControllerTest {

    @Autowired private MockMvc mockMvc;
    @Autowired private RateLimiterEngine engine;

    @BeforeEach
    void resetLimiter() {
        engine.clear();
    }

    private static RequestPostProcessor remote(String address) {
        return request -> {
            request.setRemoteAddr(address);
            return request;
        };
    }

    @Test
    void health_returns200() throws Exception {
        mockMvc.perform(get("/health"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.service").value("plant-care-api"))
            .andExpect(jsonPath("$.version").value("1.0.0-test"));
    }

    @Test
    void detailedHealth_reportsComponents() throws Exception {
        mockMvc.perform(get("/api/v1/health").with(remote("198.51.100.20")));

        mockMvc.perform(get("/health/detailed"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.status").value("healthy"))
            .andExpect(jsonPath("$.environment").value("test"))
            .andExpect(jsonPath("$.dependencies.rate_limiter.tracked_clients").value(1))
            .andExpect(jsonPath("$.dependencies.rate_limiter.max_clients").value(100))
            .andExpect(jsonPath("$.dependencies.rate_limiter.max_calls").value(3))
            .andExpect(jsonPath("$.dependencies.housekeeping.status").value("healthy"))
            .andExpect(jsonPath("$.dependencies.housekeeping.interval_seconds").value(3600))
            .andExpect(jsonPath("$.dependencies.grpc.status").value("disabled"));
    }

    @Test
    void root_describesApi() throws Exception {
        mockMvc.perform(get("/").with(remote("198.51.100.21")))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.health").value("/health"))
            .andExpect(jsonPath("$.docs").value("/docs"));
    }

    @Test
    void apiV1Index_listsFeatureAreas() throws Exception {
        for (String path : new String[] {"/api/v1", "/api/v1/"}) {
            mockMvc.perform(get(path).with(remote("198.51.100.25")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Plant Care API v1"))
                .andExpect(jsonPath("$.version").value("1.0.0-test"))
                .andExpect(jsonPath("$.documentation").value("/docs"))
                .andExpect(jsonPath("$.health").value("/api/v1/health"))
                .andExpect(jsonPath("$.endpoints.plants").value("/api/v1/plants"))
                .andExpect(jsonPath("$.endpoints.health").value("/api/v1/plant-health"))
                .andExpect(jsonPath("$.endpoints.admin").value("/api/v1/admin"));
        }
    }

    @Test
    void unknownRoute_returns404Envelope() throws Exception {
        mockMvc.perform(get("/api/v1/does-not-exist").with(remote("198.51.100.22")))
            .andExpect(status().isNotFound())
            .andExpect(jsonPath("$.error.code").value("NOT_FOUND"))
            .andExpect(jsonPath("$.error.request_id").exists());
    }

    @Test
    void wrongMethod_returns405Envelope() throws Exception {
        mockMvc.perform(delete("/health"))
            .andExpect(status().isMethodNotAllowed())
            .andExpect(jsonPath("$.error.code").value("METHOD_NOT_ALLOWED"));
    }

    @Test
    void corsPreflight_allowsConfiguredOrigin() throws Exception {
        mockMvc.perform(options("/api/v1/health")
                .header("Origin", "https://plants.example.com")
                .header("Access-Control-Request-Method", "GET")
                .with(remote("198.51.100.23")))
            .andExpect(status().isOk())
            .andExpect(header().string("Access-Control-Allow-Origin", "https://plants.example.com"));
    }

    @Test
    void corsPreflight_rejectsUnknownOrigin() throws Exception {
        mockMvc.perform(options("/api/v1/health")
                .header("Origin", "https://evil.example.org")
                .header("Access-Control-Request-Method", "GET")
                .with(remote("198.51.100.24")))
            .andExpect(status().isForbidden());
    }
}
