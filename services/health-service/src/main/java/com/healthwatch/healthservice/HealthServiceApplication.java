package com.healthwatch.healthservice;

import com.healthwatch.healthservice.config.HealthServiceProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Healthwatch health service.
 *
 * <p>Serves the four health reports of the configured service:
 *
 * <ul>
 *   <li>{@code GET /health} basic status from resource usage and error rate
 *   <li>{@code GET /health/detailed} the same plus samples, metrics and uptime
 *   <li>{@code GET /health/dependencies} configured dependency probes
 *   <li>{@code GET /health/integration-test} registered integration tests
 * </ul>
 *
 * <p>Request metrics are collected by a servlet filter and published to the metrics store on a
 * fixed delay, which is why scheduling is enabled.
 */
@SpringBootApplication
@EnableConfigurationProperties(HealthServiceProperties.class)
@EnableScheduling
public class HealthServiceApplication {

    private static final Logger log = LoggerFactory.getLogger(HealthServiceApplication.class);

    public static void main(String[] args) {
        SpringApplication.run(HealthServiceApplication.class, args);
        log.info("Healthwatch health service started successfully");
    }
}
