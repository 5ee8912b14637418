package plantcare.api.config;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import plantcare.core.clock.Clock;
import plantcare.core.clock.SystemClock;
import plantcare.engine.LimiterConfig;
import plantcare.engine.PurgeScheduler;
import plantcare.engine.RateLimiterEngine;
import plantcare.grpc.RateLimitServer;

/**
 * Builds the single rate limiter instance shared by the HTTP filter chain, the purge
 * housekeeping job and the gRPC check service.
 */
@Configuration
public class RateLimiterConfiguration {

    @Bean
    public Clock clock() {
        return SystemClock.instance();
    }

    @Bean
    public LimiterConfig limiterConfig(PlantCareProperties properties) {
        return properties.getRateLimit().toLimiterConfig();
    }

    @Bean
    public RateLimiterEngine rateLimiterEngine(Clock clock, LimiterConfig limiterConfig) {
        return new RateLimiterEngine(clock, limiterConfig);
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    public PurgeScheduler purgeScheduler(RateLimiterEngine engine, PlantCareProperties properties) {
        return new PurgeScheduler(engine, properties.getRateLimit().getPurgeIntervalSeconds());
    }

    @Bean(initMethod = "start", destroyMethod = "stop")
    @ConditionalOnProperty(prefix = "plantcare.grpc", name = "enabled", havingValue = "true", matchIfMissing = true)
    public RateLimitServer rateLimitServer(RateLimiterEngine engine, PlantCareProperties properties) {
        return new RateLimitServer(properties.getGrpc().getPort(), engine);
    }
}
