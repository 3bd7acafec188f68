package com.healthwatch.healthservice.infrastructure;

import com.healthwatch.health.MetricsCollector;
import com.healthwatch.health.MetricsStore;
import com.healthwatch.health.ServiceMetrics;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Publishes the collected request metrics to the metrics store on a fixed delay.
 */
@Component
@ConditionalOnProperty(
        prefix = "healthwatch.service",
        name = "collect-request-metrics",
        havingValue = "true",
        matchIfMissing = true)
public class MetricsPublisher {

    private static final Logger log = LoggerFactory.getLogger(MetricsPublisher.class);

    private final MetricsCollector collector;
    private final MetricsStore store;

    public MetricsPublisher(MetricsCollector collector, MetricsStore store) {
        this.collector = collector;
        this.store = store;
    }

    @Scheduled(
            fixedDelayString = "${healthwatch.service.metrics-publish-interval:PT30S}",
            initialDelayString = "${healthwatch.service.metrics-publish-interval:PT30S}")
    public void publish() {
        try {
            ServiceMetrics published = collector.publishTo(store);
            log.debug("Published request metrics: {} requests, error rate {}",
                    published.requestCount(), published.errorRate());
        } catch (RuntimeException e) {
            log.warn("Publishing request metrics failed, keeping the previous snapshot", e);
        }
    }
}
