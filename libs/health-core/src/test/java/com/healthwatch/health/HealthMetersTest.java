package com.healthwatch.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.healthwatch.health.report.ReportKind;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Duration;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

/**
 * Tests for {@link HealthMeters}: service tagging, report gauges and timers, failure counters.
 */
@DisplayName("HealthMeters")
class HealthMetersTest {

    private SimpleMeterRegistry registry;
    private HealthMeters meters;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        meters = new HealthMeters(registry, "test-service");
    }

    @Nested
    @DisplayName("Construction")
    class Construction {

        @Test
        @DisplayName("should reject null registry")
        void shouldRejectNullRegistry() {
            assertThatThrownBy(() -> new HealthMeters(null, "svc"))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("registry");
        }

        @Test
        @DisplayName("should reject blank service name")
        void shouldRejectBlankServiceName() {
            assertThatThrownBy(() -> new HealthMeters(registry, "  "))
                    .isInstanceOf(IllegalArgumentException.class)
                    .hasMessageContaining("serviceName");
        }

        @Test
        @DisplayName("should register a gauge and a timer per report kind")
        void shouldRegisterPerKind() {
            assertThat(registry.find(HealthMeters.REPORT_STATUS).gauges()).hasSize(ReportKind.values().length);
            assertThat(registry.find(HealthMeters.REPORT_DURATION).timers()).hasSize(ReportKind.values().length);
            assertThat(meters.registry()).isSameAs(registry);
            assertThat(meters.serviceName()).isEqualTo("test-service");
        }
    }

    @Test
    @DisplayName("should record report severity and duration with service tag")
    void shouldRecordReport() {
        meters.recordReport(ReportKind.DEPENDENCIES, HealthStatus.DEGRADED, Duration.ofMillis(120));

        Gauge gauge = registry.get(HealthMeters.REPORT_STATUS)
                .tag(HealthMeters.TAG_SERVICE, "test-service")
                .tag("kind", "dependencies")
                .gauge();
        Timer timer = registry.get(HealthMeters.REPORT_DURATION).tag("kind", "dependencies").timer();
        assertThat(gauge.value()).isEqualTo(1.0);
        assertThat(timer.count()).isEqualTo(1);
        assertThat(timer.totalTime(TimeUnit.MILLISECONDS)).isEqualTo(120.0);
    }

    @Test
    @DisplayName("should count check failures per check")
    void shouldCountCheckFailures() {
        meters.recordCheckFailure("integration_test", "login-flow");
        meters.recordCheckFailure("integration_test", "login-flow");
        meters.recordCheckFailure("dependency", "redis-cache");

        assertThat(registry.get(HealthMeters.CHECK_FAILURES).tag("check", "login-flow").counter().count())
                .isEqualTo(2.0);
        assertThat(registry.get(HealthMeters.CHECK_FAILURES).tag("kind", "dependency").counter().count())
                .isEqualTo(1.0);
    }
}
