package plantcare.api.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;
import plantcare.engine.LimiterConfig;
import plantcare.grpc.RateLimitServer;

/**
 * Typed configuration for the plant-care API.
 *
 * <p>Values are bound from {@code plantcare.*} in {@code application.yml} and environment
 * variables (e.g. {@code PLANTCARE_RATE_LIMIT_MAX_CALLS}). Validation runs at startup, so a
 * bad value stops the application before it serves traffic.
 */
@Validated
@ConfigurationProperties(prefix = "plantcare")
public class PlantCareProperties {
    @NotBlank
    private String environment = "development";
    private boolean debug = true;
    @NotBlank
    private String version = "1.0.0";
    /** Host header values accepted outside debug mode; {@code *.domain} matches subdomains. */
    @NotNull
    private List<String> allowedHosts = new ArrayList<>(List.of("localhost", "127.0.0.1", "0.0.0.0"));

    @Valid
    private final RateLimit rateLimit = new RateLimit();
    @Valid
    private final Grpc grpc = new Grpc();
    private final Cors cors = new Cors();

    public String getEnvironment() {
        return environment;
    }

    public void setEnvironment(String environment) {
        this.environment = environment;
    }

    public boolean isDebug() {
        return debug;
    }

    public void setDebug(boolean debug) {
        this.debug = debug;
    }

    public String getVersion() {
        return version;
    }

    public void setVersion(String version) {
        this.version = version;
    }

    public List<String> getAllowedHosts() {
        return allowedHosts;
    }

    public void setAllowedHosts(List<String> allowedHosts) {
        this.allowedHosts = allowedHosts;
    }

    public RateLimit getRateLimit() {
        return rateLimit;
    }

    public Grpc getGrpc() {
        return grpc;
    }

    public Cors getCors() {
        return cors;
    }

    /** Rate limiter policy and housekeeping. */
    public static class RateLimit {
        @Min(1)
        private int maxCalls = LimiterConfig.DEFAULT_MAX_CALLS;
        @Min(1)
        private int windowSeconds = LimiterConfig.DEFAULT_WINDOW_SECONDS;
        @NotNull
        private Set<String> exemptPaths = new LinkedHashSet<>(LimiterConfig.DEFAULT_EXEMPT_PATHS);
        @Min(1)
        private int maxClients = LimiterConfig.DEFAULT_MAX_CLIENTS;
        @Min(1)
        private long purgeIntervalSeconds = 60;

        public int getMaxCalls() {
            return maxCalls;
        }

        public void setMaxCalls(int maxCalls) {
            this.maxCalls = maxCalls;
        }

        public int getWindowSeconds() {
            return windowSeconds;
        }

        public void setWindowSeconds(int windowSeconds) {
            this.windowSeconds = windowSeconds;
        }

        public Set<String> getExemptPaths() {
            return exemptPaths;
        }

        public void setExemptPaths(Set<String> exemptPaths) {
            this.exemptPaths = exemptPaths;
        }

        public int getMaxClients() {
            return maxClients;
        }

        public void setMaxClients(int maxClients) {
            this.maxClients = maxClients;
        }

        public long getPurgeIntervalSeconds() {
            return purgeIntervalSeconds;
        }

        public void setPurgeIntervalSeconds(long purgeIntervalSeconds) {
            this.purgeIntervalSeconds = purgeIntervalSeconds;
        }

        public LimiterConfig toLimiterConfig() {
            return new LimiterConfig(maxCalls, windowSeconds, exemptPaths, maxClients);
        }
    }

    /** gRPC check service exposure. */
    public static class Grpc {
        private boolean enabled = true;
        @Min(0)
        @Max(65535)
        private int port = RateLimitServer.DEFAULT_PORT;

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }
    }

    /** Browser origins allowed to call the API outside debug mode. */
    public static class Cors {
        private List<String> allowedOrigins = new ArrayList<>();

        public List<String> getAllowedOrigins() {
            return allowedOrigins;
        }

        public void setAllowedOrigins(List<String> allowedOrigins) {
            this.allowedOrigins = allowedOrigins;
        }
    }
}
