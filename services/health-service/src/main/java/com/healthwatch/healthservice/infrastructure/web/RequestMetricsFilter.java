package com.healthwatch.healthservice.infrastructure.web;

import com.healthwatch.health.MetricsCollector;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.concurrent.TimeUnit;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

/**
 * Servlet filter that records every served request in the {@link MetricsCollector}.
 *
 * <p>A response status of 400 or above, or an exception escaping the chain, counts as an error.
 * Runs first so the measured time covers the whole chain.
 */
@Component
@Order(Ordered.HIGHEST_PRECEDENCE)
@ConditionalOnProperty(
        prefix = "healthwatch.service",
        name = "collect-request-metrics",
        havingValue = "true",
        matchIfMissing = true)
public class RequestMetricsFilter extends OncePerRequestFilter {

    private final MetricsCollector collector;

    public RequestMetricsFilter(MetricsCollector collector) {
        this.collector = collector;
    }

    @Override
    protected void doFilterInternal(
            HttpServletRequest request, HttpServletResponse response, FilterChain filterChain)
            throws ServletException, IOException {
        long startNanos = System.nanoTime();
        boolean failed = true;
        try {
            filterChain.doFilter(request, response);
            failed = response.getStatus() >= 400;
        } finally {
            double elapsedMs = (System.nanoTime() - startNanos) / (double) TimeUnit.MILLISECONDS.toNanos(1);
            collector.recordRequest(elapsedMs, failed);
        }
    }
}
