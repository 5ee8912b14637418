package plantcare.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import plantcare.api.error.ErrorBody;
import plantcare.core.model.RateLimitResult;
import plantcare.engine.LimiterConfig;
import plantcare.engine.RateLimiterEngine;

/**
 * Servlet filter enforcing the per-client fixed window limit ahead of every handler.
 *
 * <p>Admitted requests continue with {@code X-RateLimit-*} headers attached; rejected ones
 * are answered here with HTTP 429, {@code Retry-After} and a {@code RATE_LIMIT_EXCEEDED} body.
 * Exempt paths skip the limiter before any state lookup.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 30)
public class RateLimitFilter extends OncePerRequestFilter {
    public static final String LIMIT_HEADER = "X-RateLimit-Limit";
    public static final String REMAINING_HEADER = "X-RateLimit-Remaining";
    public static final String RESET_HEADER = "X-RateLimit-Reset";
    public static final String RETRY_AFTER_HEADER = "Retry-After";

    private static final Logger log = LoggerFactory.getLogger(RateLimitFilter.class);

    private final RateLimiterEngine engine;
    private final ObjectMapper objectMapper;

    public RateLimitFilter(RateLimiterEngine engine, ObjectMapper objectMapper) {
        this.engine = engine;
        this.objectMapper = objectMapper;
    }

    @Override
    protected boolean shouldNotFilter(HttpServletRequest request) {
        return engine.getConfig().isExempt(request.getRequestURI());
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain)
        throws ServletException, IOException {
        String client = ClientKeys.resolve(request);
        RateLimitResult result = engine.check(client, request.getRequestURI());

        if (result.hasQuota()) {
            response.setHeader(LIMIT_HEADER, String.valueOf(result.limit()));
            response.setHeader(REMAINING_HEADER, String.valueOf(result.remaining()));
            response.setHeader(RESET_HEADER, String.valueOf(result.resetEpochSeconds()));
        }

        if (!result.admitted()) {
            reject(response, client, result);
            return;
        }

        filterChain.doFilter(request, response);
    }

    private void reject(HttpServletResponse response, String client, RateLimitResult result)
        throws IOException {
        LimiterConfig config = engine.getConfig();
        log.warn("Rate limit exceeded for client {}: retry in {}s", client, result.retryAfterHeaderSeconds());

        response.setStatus(HttpStatus.TOO_MANY_REQUESTS.value());
        response.setHeader(RETRY_AFTER_HEADER, String.valueOf(result.retryAfterHeaderSeconds()));
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        String message = String.format("Rate limit exceeded: %d requests per %d seconds",
            config.maxCalls(), config.windowSeconds());
        objectMapper.writeValue(response.getWriter(), ErrorBody.of(
            "RATE_LIMIT_EXCEEDED", message, Map.of("retry_after", result.retryAfterSeconds())));
    }
}
