package plantcare.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import plantcare.api.config.PlantCareProperties;
import plantcare.api.error.ErrorBody;

/**
 * Rejects requests whose {@code Host} is not in {@code plantcare.allowed-hosts}.
 *
 * <p>Entries match exactly, or as {@code *.domain} for any subdomain. Disabled in debug mode
 * and when the list contains {@code *}. Runs before the rate limiter, so a refused host costs
 * no quota.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 25)
public class TrustedHostFilter extends OncePerRequestFilter {
    private static final Logger log = LoggerFactory.getLogger(TrustedHostFilter.class);

    private final PlantCareProperties properties;
    private final ObjectMapper objectMapper;

    public TrustedHostFilter(PlantCareProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return properties.isDebug() || properties.getAllowedHosts().contains("*");
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain)
        throws ServletException, IOException {
        String host = hostOf(request);
        if (isAllowed(host, properties.getAllowedHosts())) {
            filterChain.doFilter(request, response);
            return;
        }

        log.warn("Rejected request for untrusted host '{}'", host);
        response.setStatus(HttpStatus.BAD_REQUEST.value());
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getWriter(),
            ErrorBody.of("INVALID_HOST", "Invalid host header", Map.of()));
    }

    static boolean isAllowed(String host, List<String> allowedHosts) {
        if (host.isEmpty()) {
            return false;
        }
        for (String pattern : allowedHosts) {
            String candidate = pattern.toLowerCase(Locale.ROOT);
            if (candidate.startsWith("*.")) {
                // "*.example.com" covers "api.example.com" but not "example.com"
                if (host.endsWith(candidate.substring(1))) {
                    return true;
                }
            } else if (host.equals(candidate)) {
                return true;
            }
        }
        return false;
    }

    static String hostOf(HttpServletRequest request) {
        String header = request.getHeader("Host");
        String host = header == null || header.isBlank() ? request.getServerName() : header.trim();
        if (host == null) {
            return "";
        }
        if (host.startsWith("[")) {
            int close = host.indexOf(']');
            host = close > 0 ? host.substring(0, close + 1) : host;
        } else {
            int colon = host.lastIndexOf(':');
            if (colon >= 0 && host.indexOf(':') == colon) {
                host = host.substring(0, colon);
            }
        }
        return host.toLowerCase(Locale.ROOT);
    }
}
