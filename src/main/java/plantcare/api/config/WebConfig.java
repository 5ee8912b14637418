package plantcare.api.config;

import java.util.List;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.servlet.config.annotation.CorsRegistry;
import org.springframework.web.servlet.config.annotation.WebMvcConfigurer;

/**
 * CORS policy: any origin in debug mode, otherwise only the configured allowlist.
 */
@Configuration
public class WebConfig implements WebMvcConfigurer {
    private final PlantCareProperties properties;

    public WebConfig(PlantCareProperties properties) {
        this.properties = properties;
    }

    @Override
    public void addCorsMappings(CorsRegistry registry) {
        if (properties.isDebug()) {
            registry
                .addMapping("/**")
                .allowedOriginPatterns("*")
                .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
                .allowedHeaders("Content-Type", "Authorization", "X-Requested-With")
                .maxAge(3600);
            return;
        }

        List<String> allowedOrigins = properties.getCors().getAllowedOrigins().stream()
            .filter(origin -> origin != null && !origin.isBlank())
            .toList();
        if (allowedOrigins.isEmpty()) {
            return;
        }

        registry
            .addMapping("/**")
            .allowedOrigins(allowedOrigins.toArray(String[]::new))
            .allowedMethods("GET", "POST", "PUT", "DELETE", "OPTIONS")
            .allowedHeaders("Content-Type", "Authorization", "X-Requested-With")
            .allowCredentials(true)
            .maxAge(3600);
    }
}
