package com.healthwatch.healthservice.config;

import com.healthwatch.health.HealthThresholds;
import com.healthwatch.health.ServiceInfo;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import java.net.URI;
import java.time.Duration;
import java.util.List;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Type-safe configuration of the health service, bound from {@code healthwatch.service.*}.
 *
 * <pre>
 * healthwatch:
 *   service:
 *     name: user-service
 *     version: 2.3.1
 *     environment: production
 *     build: abc123
 *     check-timeout: 5s
 *     thresholds:
 *       resource-unhealthy-percent: 90
 *     dependencies:
 *       http:
 *         - name: payments-api
 *           url: http://payments.internal/health
 *       storage:
 *         - name: uploads
 *           path: /var/lib/uploads
 * </pre>
 *
 * @param name                   service name reported in every payload and metric tag. Required.
 * @param version                service version (default 1.0.0)
 * @param environment            deployment environment (default development)
 * @param build                  build identifier, optional
 * @param checkTimeout           timeout for each dependency probe and integration test (default 5s)
 * @param metricsPublishInterval delay between request metric publications (default 30s)
 * @param collectRequestMetrics  whether served requests feed the metrics store (default true)
 * @param thresholds             basic status thresholds
 * @param dependencies           dependencies probed by the dependencies report
 */
@ConfigurationProperties(prefix = "healthwatch.service")
@Validated
public record HealthServiceProperties(
        @NotBlank String name,
        String version,
        String environment,
        String build,
        Duration checkTimeout,
        Duration metricsPublishInterval,
        Boolean collectRequestMetrics,
        @Valid Thresholds thresholds,
        @Valid Dependencies dependencies) {

    public HealthServiceProperties {
        if (version == null || version.isBlank()) {
            version = ServiceInfo.DEFAULT_VERSION;
        }
        if (environment == null || environment.isBlank()) {
            environment = "development";
        }
        if (build != null && build.isBlank()) {
            build = null;
        }
        if (checkTimeout == null || checkTimeout.isZero() || checkTimeout.isNegative()) {
            checkTimeout = Duration.ofSeconds(5);
        }
        if (metricsPublishInterval == null || metricsPublishInterval.isZero() || metricsPublishInterval.isNegative()) {
            metricsPublishInterval = Duration.ofSeconds(30);
        }
        if (collectRequestMetrics == null) {
            collectRequestMetrics = Boolean.TRUE;
        }
        if (thresholds == null) {
            thresholds = new Thresholds(null, null, null, null);
        }
        if (dependencies == null) {
            dependencies = new Dependencies(null, null);
        }
    }

    /** Static description handed to the monitor. */
    public ServiceInfo serviceInfo() {
        return new ServiceInfo(name, version, environment, build);
    }

    /**
     * Basic status thresholds; any value left out keeps its default.
     */
    public record Thresholds(
            Double resourceUnhealthyPercent,
            Double resourceDegradedPercent,
            Double errorRateUnhealthy,
            Double errorRateDegraded) {

        public Thresholds {
            HealthThresholds defaults = HealthThresholds.DEFAULTS;
            if (resourceUnhealthyPercent == null) {
                resourceUnhealthyPercent = defaults.resourceUnhealthyPercent();
            }
            if (resourceDegradedPercent == null) {
                resourceDegradedPercent = defaults.resourceDegradedPercent();
            }
            if (errorRateUnhealthy == null) {
                errorRateUnhealthy = defaults.errorRateUnhealthy();
            }
            if (errorRateDegraded == null) {
                errorRateDegraded = defaults.errorRateDegraded();
            }
        }

        /**
         * @throws IllegalArgumentException if the values are out of range or inverted
         */
        public HealthThresholds toHealthThresholds() {
            return new HealthThresholds(
                    resourceUnhealthyPercent, resourceDegradedPercent, errorRateUnhealthy, errorRateDegraded);
        }
    }

    /**
     * Dependencies declared in configuration.
     */
    public record Dependencies(@Valid List<HttpDependency> http, @Valid List<StorageDependency> storage) {

        public Dependencies {
            http = http == null ? List.of() : List.copyOf(http);
            storage = storage == null ? List.of() : List.copyOf(storage);
        }
    }

    /**
     * An HTTP endpoint that must answer {@code expectedStatus} to GET (default 200).
     */
    public record HttpDependency(@NotBlank String name, @NotNull URI url, int expectedStatus) {

        public HttpDependency {
            if (expectedStatus <= 0) {
                expectedStatus = 200;
            }
        }
    }

    /**
     * A path on a mounted volume that must exist and be readable.
     */
    public record StorageDependency(@NotBlank String name, @NotBlank String path) {
    }
}
