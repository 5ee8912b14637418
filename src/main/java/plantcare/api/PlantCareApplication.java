package plantcare.api;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import plantcare.api.config.PlantCareProperties;

/**
 * Entry point for the plant-care API.
 *
 * <p>Serves the HTTP shell (health, API v1) behind the logging, security-header
 * and rate-limit filters, and optionally the gRPC rate limit check service.
 */
@SpringBootApplication
@EnableConfigurationProperties(PlantCareProperties.class)
public class PlantCareApplication {

    public static void main(String[] args) {
        SpringApplication.run(PlantCareApplication.class, args);
    }
}
