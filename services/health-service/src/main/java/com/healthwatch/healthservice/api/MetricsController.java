package com.healthwatch.healthservice.api;

import com.healthwatch.health.MetricsStore;
import com.healthwatch.health.ServiceMetrics;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.web.bind.annotation.PatchMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Lets the host service push its own request metrics.
 *
 * <p>The body is a partial map of snake_case metric fields. Unknown fields are ignored; a
 * recognized field with an invalid value is rejected with 400 by the exception handler.
 */
@RestController
public class MetricsController {

    private static final Logger log = LoggerFactory.getLogger(MetricsController.class);

    private final MetricsStore store;

    public MetricsController(MetricsStore store) {
        this.store = store;
    }

    @PatchMapping("/health/metrics")
    public ServiceMetrics update(@RequestBody Map<String, Object> changes) {
        ServiceMetrics updated = store.update(changes);
        log.debug("Metrics updated with fields {}", changes.keySet());
        return updated;
    }
}
