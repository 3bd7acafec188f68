package com.healthwatch.healthservice.infrastructure.web;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthwatch.health.MetricsCollector;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

/**
 * Unit tests for {@link RequestMetricsFilter}, using servlet mocks only.
 */
@DisplayName("RequestMetricsFilter")
class RequestMetricsFilterTest {

    private final MetricsCollector collector = new MetricsCollector();
    private final RequestMetricsFilter filter = new RequestMetricsFilter(collector);

    @Test
    @DisplayName("records a successful request")
    void recordsSuccessfulRequest() throws Exception {
        var response = new MockHttpServletResponse();
        FilterChain chain = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest("GET", "/health"), response, chain);

        assertThat(collector.snapshot().requestCount()).isEqualTo(1);
        assertThat(collector.snapshot().errorRate()).isZero();
        assertThat(collector.snapshot().lastRequestTimestamp()).isNotNull();
    }

    @Test
    @DisplayName("counts 4xx and 5xx responses as errors")
    void countsErrorStatuses() throws Exception {
        FilterChain notFound = (req, resp) -> ((MockHttpServletResponse) resp).setStatus(404);
        FilterChain ok = (req, resp) -> {};

        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), notFound);
        filter.doFilter(new MockHttpServletRequest(), new MockHttpServletResponse(), ok);

        assertThat(collector.snapshot().requestCount()).isEqualTo(2);
        assertThat(collector.snapshot().errorRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("counts an exception escaping the chain as an error")
    void countsExceptionAsError() {
        FilterChain failing = (req, resp) -> {
            throw new ServletException("boom");
        };

        assertThatThrownBy(() -> filter.doFilter(
                new MockHttpServletRequest(), new MockHttpServletResponse(), failing))
                .isInstanceOf(ServletException.class);
        assertThat(collector.snapshot().errorRate()).isEqualTo(1.0);
    }
}
