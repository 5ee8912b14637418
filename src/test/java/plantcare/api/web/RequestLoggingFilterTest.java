package plantcare.api.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

class RequestLoggingFilterTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final RequestLoggingFilter filter = new RequestLoggingFilter(objectMapper);

    @Test
    void successfulRequest_getsRequestIdHeaderAndAttribute() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/v1/health");
        MockHttpServletResponse response = new MockHttpServletResponse();

        filter.doFilter(request, response, (req, res) -> ((MockHttpServletResponse) res).setStatus(200));

        String requestId = response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER);
        assertThat(requestId).isNotBlank();
        assertThat(request.getAttribute(RequestLoggingFilter.REQUEST_ID_ATTRIBUTE)).isEqualTo(requestId);
        assertThat(response.getStatus()).isEqualTo(200);
    }

    @Test
    void eachRequest_getsDistinctId() throws Exception {
        MockHttpServletResponse first = new MockHttpServletResponse();
        MockHttpServletResponse second = new MockHttpServletResponse();

        filter.doFilter(new MockHttpServletRequest("GET", "/"), first, (req, res) -> { });
        filter.doFilter(new MockHttpServletRequest("GET", "/"), second, (req, res) -> { });

        assertThat(first.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER))
            .isNotEqualTo(second.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER));
    }

    @Test
    void escapingException_becomes500Envelope() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("POST", "/api/v1/plants");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain failing = (req, res) -> {
            throw new IllegalStateException("boom");
        };

        filter.doFilter(request, response, failing);

        assertThat(response.getStatus()).isEqualTo(500);
        JsonNode body = objectMapper.readTree(response.getContentAsString());
        assertThat(body.path("error").path("code").asText()).isEqualTo("INTERNAL_SERVER_ERROR");
        assertThat(body.path("error").path("message").asText()).isEqualTo("An unexpected error occurred");
        assertThat(body.path("error").path("request_id").asText())
            .isEqualTo(response.getHeader(RequestLoggingFilter.REQUEST_ID_HEADER));
    }

    @Test
    void exceptionAfterCommit_isRethrown() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/stream");
        MockHttpServletResponse response = new MockHttpServletResponse();
        FilterChain failing = (req, res) -> {
            res.getWriter().write("partial");
            res.flushBuffer();
            throw new ServletException("late failure");
        };

        assertThrows(ServletException.class, () -> filter.doFilter(request, response, failing));
    }
}
