package com.healthwatch.health;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

@DisplayName("HealthStatus")
class HealthStatusTest {

    @Nested
    @DisplayName("worst")
    class Worst {

        @Test
        @DisplayName("should let the more severe status win")
        void shouldPickMoreSevere() {
            assertThat(HealthStatus.HEALTHY.worst(HealthStatus.DEGRADED)).isEqualTo(HealthStatus.DEGRADED);
            assertThat(HealthStatus.DEGRADED.worst(HealthStatus.UNHEALTHY)).isEqualTo(HealthStatus.UNHEALTHY);
            assertThat(HealthStatus.UNHEALTHY.worst(HealthStatus.HEALTHY)).isEqualTo(HealthStatus.UNHEALTHY);
        }

        @ParameterizedTest
        @EnumSource(HealthStatus.class)
        @DisplayName("should be idempotent")
        void shouldBeIdempotent(HealthStatus status) {
            assertThat(status.worst(status)).isEqualTo(status);
        }

        @Test
        @DisplayName("should reject null")
        void shouldRejectNull() {
            assertThatThrownBy(() -> HealthStatus.HEALTHY.worst(null))
                    .isInstanceOf(IllegalArgumentException.class);
        }

        @Test
        @DisplayName("should fold an empty collection to HEALTHY")
        void shouldFoldEmptyToHealthy() {
            assertThat(HealthStatus.worstOf(List.of())).isEqualTo(HealthStatus.HEALTHY);
        }

        @Test
        @DisplayName("should fold a collection to its worst member")
        void shouldFoldToWorst() {
            assertThat(HealthStatus.worstOf(List.of(HealthStatus.HEALTHY, HealthStatus.DEGRADED, HealthStatus.HEALTHY)))
                    .isEqualTo(HealthStatus.DEGRADED);
        }
    }

    @Test
    @DisplayName("should rank statuses by severity")
    void shouldRankBySeverity() {
        assertThat(HealthStatus.UNHEALTHY.isWorseThan(HealthStatus.DEGRADED)).isTrue();
        assertThat(HealthStatus.DEGRADED.isWorseThan(HealthStatus.HEALTHY)).isTrue();
        assertThat(HealthStatus.HEALTHY.isWorseThan(HealthStatus.HEALTHY)).isFalse();
    }

    @Test
    @DisplayName("should use lower-case wire values")
    void shouldUseLowerCaseWireValues() {
        assertThat(HealthStatus.HEALTHY.wireValue()).isEqualTo("healthy");
        assertThat(HealthStatus.DEGRADED.wireValue()).isEqualTo("degraded");
        assertThat(HealthStatus.UNHEALTHY.wireValue()).isEqualTo("unhealthy");
    }
}
