package plantcare.api.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;
import org.springframework.boot.autoconfigure.AutoConfigurations;
import org.springframework.boot.autoconfigure.validation.ValidationAutoConfiguration;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.boot.test.context.runner.ApplicationContextRunner;
import org.springframework.context.annotation.Configuration;
import plantcare.engine.LimiterConfig;

class PlantCarePropertiesTest {

    private final ApplicationContextRunner runner = new ApplicationContextRunner()
        .withConfiguration(AutoConfigurations.of(ValidationAutoConfiguration.class))
        .withUserConfiguration(PropertiesOnly.class);

    @Test
    void defaults_matchLimiterDefaults() {
        runner.run(context -> {
            PlantCareProperties properties = context.getBean(PlantCareProperties.class);
            LimiterConfig config = properties.getRateLimit().toLimiterConfig();

            assertThat(config.maxCalls()).isEqualTo(100);
            assertThat(config.windowSeconds()).isEqualTo(60);
            assertThat(config.exemptPaths()).containsExactlyInAnyOrder("/health", "/health/detailed");
            assertThat(properties.getGrpc().getPort()).isEqualTo(9090);
            assertThat(properties.getAllowedHosts()).containsExactly("localhost", "127.0.0.1", "0.0.0.0");
        });
    }

    @Test
    void bindsRateLimitSettings() {
        runner
            .withPropertyValues(
                "plantcare.environment=production",
                "plantcare.rate-limit.max-calls=25",
                "plantcare.rate-limit.window-seconds=10",
                "plantcare.rate-limit.exempt-paths=/status,/ready",
                "plantcare.allowed-hosts=api.plants.example.com,*.plants.example.com")
            .run(context -> {
                PlantCareProperties properties = context.getBean(PlantCareProperties.class);
                LimiterConfig config = properties.getRateLimit().toLimiterConfig();

                assertThat(config.maxCalls()).isEqualTo(25);
                assertThat(config.windowSeconds()).isEqualTo(10);
                assertThat(config.isExempt("/ready")).isTrue();
                assertThat(config.isExempt("/health")).isFalse();
                assertThat(properties.getEnvironment()).isEqualTo("production");
                assertThat(properties.getAllowedHosts()).containsExactly("api.plants.example.com", "*.plants.example.com");
            });
    }

    @Test
    void invalidLimit_failsStartup() {
        runner
            .withPropertyValues("plantcare.rate-limit.max-calls=0")
            .run(context -> assertThat(context).hasFailed());
    }

    @Test
    void invalidWindow_failsStartup() {
        runner
            .withPropertyValues("plantcare.rate-limit.window-seconds=-5")
            .run(context -> assertThat(context).hasFailed());
    }

    @Configuration(proxyBeanMethods = false)
    @EnableConfigurationProperties(PlantCareProperties.class)
    static class PropertiesOnly {
    }
}
