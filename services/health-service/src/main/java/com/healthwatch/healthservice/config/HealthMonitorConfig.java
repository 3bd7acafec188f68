package com.healthwatch.healthservice.config;

import com.healthwatch.health.DependencyCheckers;
import com.healthwatch.health.DependencyRegistry;
import com.healthwatch.health.DependencyRunner;
import com.healthwatch.health.DependencyType;
import com.healthwatch.health.HealthAggregator;
import com.healthwatch.health.HealthMeters;
import com.healthwatch.health.HealthMonitor;
import com.healthwatch.health.IntegrationTestRegistry;
import com.healthwatch.health.IntegrationTestRunner;
import com.healthwatch.health.MetricsCollector;
import com.healthwatch.health.MetricsStore;
import com.healthwatch.health.ResourceSampler;
import com.healthwatch.health.SystemResourceSampler;
import com.healthwatch.healthservice.infrastructure.checks.MetricsSnapshotCheck;
import io.micrometer.core.instrument.MeterRegistry;
import java.net.http.HttpClient;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Wires the health engine: samplers, stores, registries, runners and the monitor.
 *
 * <p>The monitor is an ordinary singleton bean; nothing in the engine is static. Dependencies
 * come from {@link HealthServiceProperties}, so adding an HTTP or storage check is a
 * configuration change.
 */
@Configuration
public class HealthMonitorConfig {

    private static final Logger log = LoggerFactory.getLogger(HealthMonitorConfig.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ResourceSampler resourceSampler() {
        return new SystemResourceSampler();
    }

    @Bean
    public MetricsStore metricsStore() {
        return new MetricsStore();
    }

    @Bean
    public MetricsCollector metricsCollector(Clock clock) {
        return new MetricsCollector(MetricsCollector.DEFAULT_MAX_SAMPLES, clock);
    }

    @Bean
    public HealthMeters healthMeters(MeterRegistry meterRegistry, HealthServiceProperties properties) {
        return new HealthMeters(meterRegistry, properties.name());
    }

    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService healthCheckExecutor() {
        return Executors.newCachedThreadPool(new CheckThreadFactory());
    }

    @Bean
    public HttpClient healthCheckHttpClient(HealthServiceProperties properties) {
        return HttpClient.newBuilder().connectTimeout(properties.checkTimeout()).build();
    }

    @Bean
    public DependencyCheckers dependencyCheckers(ExecutorService healthCheckExecutor, Clock clock) {
        return new DependencyCheckers(healthCheckExecutor, clock);
    }

    @Bean
    public DependencyRegistry dependencyRegistry(
            HealthServiceProperties properties, DependencyCheckers checkers, HttpClient healthCheckHttpClient) {
        DependencyRegistry registry = new DependencyRegistry();
        var timeout = properties.checkTimeout();
        for (HealthServiceProperties.HttpDependency http : properties.dependencies().http()) {
            registry.register(http.name(), DependencyType.EXTERNAL_API,
                    checkers.http(http.name(), healthCheckHttpClient, http.url(), http.expectedStatus(), timeout));
        }
        for (HealthServiceProperties.StorageDependency storage : properties.dependencies().storage()) {
            registry.register(storage.name(), DependencyType.STORAGE,
                    checkers.fileSystem(storage.name(), Path.of(storage.path()), timeout));
        }
        log.info("Registered {} dependency probe(s)", registry.size());
        return registry;
    }

    @Bean
    public IntegrationTestRegistry integrationTestRegistry(MetricsStore metricsStore) {
        IntegrationTestRegistry registry = new IntegrationTestRegistry();
        registry.register(MetricsSnapshotCheck.NAME, new MetricsSnapshotCheck(metricsStore));
        log.info("Registered {} integration test(s)", registry.size());
        return registry;
    }

    @Bean
    public DependencyRunner dependencyRunner(
            DependencyRegistry registry,
            ExecutorService healthCheckExecutor,
            HealthServiceProperties properties,
            Clock clock,
            HealthMeters meters) {
        return new DependencyRunner(
                registry, healthCheckExecutor, properties.checkTimeout().toMillis(), clock, meters);
    }

    @Bean
    public IntegrationTestRunner integrationTestRunner(
            IntegrationTestRegistry registry,
            ExecutorService healthCheckExecutor,
            HealthServiceProperties properties,
            Clock clock,
            HealthMeters meters) {
        return new IntegrationTestRunner(
                registry, healthCheckExecutor, properties.checkTimeout().toMillis(), clock, meters);
    }

    @Bean
    public HealthAggregator healthAggregator(HealthServiceProperties properties) {
        return new HealthAggregator(properties.thresholds().toHealthThresholds());
    }

    @Bean
    public HealthMonitor healthMonitor(
            HealthServiceProperties properties,
            ResourceSampler resourceSampler,
            MetricsStore metricsStore,
            DependencyRunner dependencyRunner,
            IntegrationTestRunner integrationTestRunner,
            HealthAggregator healthAggregator,
            HealthMeters healthMeters,
            Clock clock) {
        log.info("Health monitor ready for service '{}' ({}, {})",
                properties.name(), properties.version(), properties.environment());
        return new HealthMonitor(
                properties.serviceInfo(),
                resourceSampler,
                metricsStore,
                dependencyRunner,
                integrationTestRunner,
                healthAggregator,
                healthMeters,
                clock);
    }

    /** Daemon threads named {@code health-check-N}. */
    private static final class CheckThreadFactory implements ThreadFactory {

        private final AtomicInteger counter = new AtomicInteger();

        @Override
        public Thread newThread(Runnable runnable) {
            Thread thread = new Thread(runnable, "health-check-" + counter.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        }
    }
}
