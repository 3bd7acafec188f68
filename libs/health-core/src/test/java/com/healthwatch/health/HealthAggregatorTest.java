package com.healthwatch.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

/**
 * Tests for {@link HealthAggregator}: rule order and strict thresholds of the basic status,
 * and the dependency and test combination rules.
 */
@DisplayName("HealthAggregator")
class HealthAggregatorTest {

    private static final Instant NOW = Instant.parse("2026-01-15T10:00:00Z");

    private final HealthAggregator aggregator = new HealthAggregator();

    private static MemoryUsage memory(double percentage) {
        return new MemoryUsage(1, 100, percentage);
    }

    private static ServiceMetrics errorRate(double rate) {
        return new ServiceMetrics(100, rate, 20.0, null, Map.of());
    }

    @Nested
    @DisplayName("basicStatus")
    class BasicStatus {

        @ParameterizedTest(name = "memory={0} cpu={1} errorRate={2} -> {3}")
        @CsvSource({
                "45.0,  20.0,   0.02, HEALTHY",
                "85.0,  ,       0.0,  DEGRADED",
                "50.0,  95.0,   0.0,  UNHEALTHY",
                "91.0,  ,       0.0,  UNHEALTHY",
                "50.0,  81.0,   0.0,  DEGRADED",
                "50.0,  ,       0.6,  UNHEALTHY",
                "50.0,  ,       0.2,  DEGRADED",
                "85.0,  ,       0.9,  DEGRADED",
                "95.0,  ,       0.0,  UNHEALTHY"
        })
        @DisplayName("should apply rules in order, first match wins")
        void shouldApplyRulesInOrder(double memory, Double cpu, double errorRate, HealthStatus expected) {
            OptionalDouble cpuSample = cpu == null ? OptionalDouble.empty() : OptionalDouble.of(cpu);

            assertThat(aggregator.basicStatus(memory(memory), cpuSample, errorRate(errorRate)))
                    .isEqualTo(expected);
        }

        @Test
        @DisplayName("should treat thresholds as strict")
        void shouldTreatThresholdsAsStrict() {
            ServiceMetrics quiet = errorRate(0.0);

            assertThat(aggregator.basicStatus(memory(90.0), OptionalDouble.empty(), quiet))
                    .isEqualTo(HealthStatus.DEGRADED);
            assertThat(aggregator.basicStatus(memory(90.0001), OptionalDouble.empty(), quiet))
                    .isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(aggregator.basicStatus(memory(80.0), OptionalDouble.empty(), quiet))
                    .isEqualTo(HealthStatus.HEALTHY);
            assertThat(aggregator.basicStatus(memory(10.0), OptionalDouble.empty(), errorRate(0.5)))
                    .isEqualTo(HealthStatus.DEGRADED);
            assertThat(aggregator.basicStatus(memory(10.0), OptionalDouble.empty(), errorRate(0.1)))
                    .isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should ignore CPU when it is not sampled")
        void shouldIgnoreMissingCpu() {
            assertThat(aggregator.basicStatus(memory(10.0), OptionalDouble.empty(), errorRate(0.0)))
                    .isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should honor custom thresholds")
        void shouldHonorCustomThresholds() {
            var lenient = new HealthAggregator(new HealthThresholds(100.0, 100.0, 1.0, 1.0));

            assertThat(lenient.basicStatus(memory(99.0), OptionalDouble.of(99.0), errorRate(0.9)))
                    .isEqualTo(HealthStatus.HEALTHY);
        }
    }

    @Nested
    @DisplayName("dependencyStatus")
    class DependencyStatus {

        @Test
        @DisplayName("should be HEALTHY with no dependencies")
        void shouldBeHealthyWhenEmpty() {
            assertThat(aggregator.dependencyStatus(List.of())).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should be UNHEALTHY when any dependency is unhealthy")
        void shouldBeUnhealthyWhenAnyUnhealthy() {
            var results = List.of(
                    DependencyHealth.healthy("db", DependencyType.DATABASE, 15, NOW),
                    DependencyHealth.failed("cache", DependencyType.CACHE, "Redis connection failed", NOW));

            assertThat(aggregator.dependencyStatus(results)).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @Test
        @DisplayName("should be DEGRADED when a dependency is degraded and none unhealthy")
        void shouldBeDegradedWhenAnyDegraded() {
            var results = List.of(
                    DependencyHealth.healthy("db", DependencyType.DATABASE, 15, NOW),
                    new DependencyHealth("queue", DependencyType.MESSAGE_QUEUE, HealthStatus.DEGRADED,
                            30.0, NOW, "backlog", null));

            assertThat(aggregator.dependencyStatus(results)).isEqualTo(HealthStatus.DEGRADED);
        }
    }

    @Nested
    @DisplayName("testStatus")
    class TestStatus {

        @Test
        @DisplayName("should prefer failures over skips")
        void shouldPreferFailures() {
            assertThat(aggregator.testStatus(new TestSummary(3, 1, 1, 1))).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(aggregator.testStatus(new TestSummary(2, 1, 0, 1))).isEqualTo(HealthStatus.DEGRADED);
            assertThat(aggregator.testStatus(new TestSummary(2, 2, 0, 0))).isEqualTo(HealthStatus.HEALTHY);
            assertThat(aggregator.testStatus(TestSummary.EMPTY)).isEqualTo(HealthStatus.HEALTHY);
        }
    }

    @Nested
    @DisplayName("HealthThresholds")
    class Thresholds {

        @Test
        @DisplayName("should reject degraded thresholds above unhealthy ones")
        void shouldRejectInvertedThresholds() {
            assertThatThrownBy(() -> new HealthThresholds(80.0, 90.0, 0.5, 0.1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new HealthThresholds(90.0, 80.0, 0.1, 0.5))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should reject out of range values")
        void shouldRejectOutOfRange() {
            assertThatThrownBy(() -> new HealthThresholds(120.0, 80.0, 0.5, 0.1))
                    .isInstanceOf(IllegalArgumentException.class);
            assertThatThrownBy(() -> new HealthThresholds(90.0, 80.0, 1.5, 0.1))
                    .isInstanceOf(IllegalArgumentException.class);
        }
    }
}
