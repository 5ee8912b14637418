package plantcare.api.web;

import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.Map;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;
import plantcare.api.error.ErrorBody;

/**
 * Outermost filter: tags each request with an id and logs its start, completion and failures.
 *
 * <p>Anything escaping the rest of the chain becomes a 500 in the standard error envelope.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE + 10)
public class RequestLoggingFilter extends OncePerRequestFilter {
    public static final String REQUEST_ID_HEADER = "X-Request-ID";
    public static final String REQUEST_ID_ATTRIBUTE = RequestLoggingFilter.class.getName() + ".requestId";

    private static final Logger log = LoggerFactory.getLogger(RequestLoggingFilter.class);

    private final ObjectMapper objectMapper;

    public RequestLoggingFilter(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    @Override
    protected void doFilterInternal(
        HttpServletRequest request,
        HttpServletResponse response,
        FilterChain filterChain)
        throws ServletException, IOException {
        String requestId = UUID.randomUUID().toString();
        request.setAttribute(REQUEST_ID_ATTRIBUTE, requestId);
        response.setHeader(REQUEST_ID_HEADER, requestId);

        long start = System.nanoTime();
        log.info("Request started: {} {} | Request ID: {} | Client: {}",
            request.getMethod(), request.getRequestURI(), requestId, ClientKeys.resolve(request));

        try {
            filterChain.doFilter(request, response);
            log.info("Request completed: {} {} | Status: {} | Duration: {}s | Request ID: {}",
                request.getMethod(), request.getRequestURI(), response.getStatus(),
                seconds(start), requestId);
        } catch (IOException | ServletException | RuntimeException e) {
            log.error("Request failed: {} {} | Error: {} | Duration: {}s | Request ID: {}",
                request.getMethod(), request.getRequestURI(), e.getMessage(),
                seconds(start), requestId, e);
            if (response.isCommitted()) {
                throw e;
            }
            response.resetBuffer();
            response.setStatus(HttpStatus.INTERNAL_SERVER_ERROR.value());
            response.setContentType(MediaType.APPLICATION_JSON_VALUE);
            response.setHeader(REQUEST_ID_HEADER, requestId);
            objectMapper.writeValue(response.getWriter(), ErrorBody.of(
                "INTERNAL_SERVER_ERROR", "An unexpected error occurred", Map.of("request_id", requestId)));
        }
    }

    private static String seconds(long startNanos) {
        return String.format("%.3f", (System.nanoTime() - startNanos) / 1_000_000_000.0);
    }
}
