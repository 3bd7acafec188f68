package com.healthwatch.healthservice.api;

import com.healthwatch.health.HealthMonitor;
import com.healthwatch.health.report.HealthReport;
import com.healthwatch.health.report.HealthResponse;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Health report endpoints.
 *
 * <p>Each endpoint answers with the status code chosen by the monitor: 200 for healthy and
 * degraded, 503 for unhealthy and for fallback payloads. The monitor never throws, so these
 * handlers never reach the exception handler.
 */
@RestController
@RequestMapping("/health")
public class HealthController {

    private final HealthMonitor monitor;

    public HealthController(HealthMonitor monitor) {
        this.monitor = monitor;
    }

    @GetMapping
    public ResponseEntity<HealthReport> health() {
        return toEntity(monitor.basicReport());
    }

    @GetMapping("/detailed")
    public ResponseEntity<HealthReport> detailed() {
        return toEntity(monitor.detailedReport());
    }

    @GetMapping("/dependencies")
    public ResponseEntity<HealthReport> dependencies() {
        return toEntity(monitor.dependenciesReport());
    }

    @GetMapping("/integration-test")
    public ResponseEntity<HealthReport> integrationTest() {
        return toEntity(monitor.integrationTestReport());
    }

    private static ResponseEntity<HealthReport> toEntity(HealthResponse response) {
        return ResponseEntity.status(response.statusCode()).body(response.body());
    }
}
