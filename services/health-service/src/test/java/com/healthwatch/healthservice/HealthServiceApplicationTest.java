package com.healthwatch.healthservice;

import static org.assertj.core.api.Assertions.assertThat;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.healthwatch.health.DependencyRegistry;
import com.healthwatch.health.HealthMonitor;
import com.healthwatch.health.IntegrationTestRegistry;
import com.healthwatch.healthservice.config.HealthServiceProperties;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

/**
 * Integration tests for the health service Spring Boot application. The 'test' profile raises
 * every threshold to its maximum so results do not depend on the host's load.
 */
@SpringBootTest
@AutoConfigureMockMvc
@ActiveProfiles("test")
@DisplayName("Health Service Application")
class HealthServiceApplicationTest {

    @Autowired private ApplicationContext context;
    @Autowired private MockMvc mockMvc;

    @Test
    @DisplayName("Spring context loads with a health monitor")
    void contextLoads() {
        assertThat(context.getBean(HealthMonitor.class)).isNotNull();
    }

    @Test
    @DisplayName("Service properties are loaded from test profile")
    void servicePropertiesAreLoaded() {
        var props = context.getBean(HealthServiceProperties.class);
        assertThat(props.name()).isEqualTo("health-service-test");
        assertThat(props.environment()).isEqualTo("test");
        assertThat(props.dependencies().storage()).hasSize(1);
    }

    @Test
    @DisplayName("Configured checks are registered")
    void configuredChecksAreRegistered() {
        assertThat(context.getBean(DependencyRegistry.class).contains("temp-dir")).isTrue();
        assertThat(context.getBean(IntegrationTestRegistry.class).contains("metrics-snapshot")).isTrue();
    }

    @Test
    @DisplayName("Basic health endpoint returns healthy status")
    void basicHealthEndpoint() throws Exception {
        mockMvc.perform(get("/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.service").value("health-service-test"))
                .andExpect(jsonPath("$.version").value("9.9.9"))
                .andExpect(jsonPath("$.timestamp").isString());
    }

    @Test
    @DisplayName("Detailed health endpoint returns samples and metrics")
    void detailedHealthEndpoint() throws Exception {
        mockMvc.perform(get("/health/detailed"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.uptime").isNumber())
                .andExpect(jsonPath("$.memory.percentage").isNumber())
                .andExpect(jsonPath("$.metrics.request_count").isNumber())
                .andExpect(jsonPath("$.environment").value("test"))
                .andExpect(jsonPath("$.build").value("test-build"));
    }

    @Test
    @DisplayName("Dependencies endpoint probes the configured storage")
    void dependenciesEndpoint() throws Exception {
        mockMvc.perform(get("/health/dependencies"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("healthy"))
                .andExpect(jsonPath("$.dependencies[0].name").value("temp-dir"))
                .andExpect(jsonPath("$.dependencies[0].type").value("storage"))
                .andExpect(jsonPath("$.dependencies[0].response_time").isNumber());
    }

    @Test
    @DisplayName("Integration test endpoint runs the built-in metrics check")
    void integrationTestEndpoint() throws Exception {
        mockMvc.perform(get("/health/integration-test"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.tests[0].name").value("metrics-snapshot"))
                .andExpect(jsonPath("$.tests[0].status").value("healthy"))
                .andExpect(jsonPath("$.summary.total").value(1))
                .andExpect(jsonPath("$.summary.passed").value(1));
    }

    @Test
    @DisplayName("Actuator exposes health and report meters")
    void actuatorEndpointsAreAvailable() throws Exception {
        mockMvc.perform(get("/actuator/health")).andExpect(status().isOk());
        mockMvc.perform(get("/health")).andExpect(status().isOk());
        mockMvc.perform(get("/actuator/metrics/healthwatch.report.duration"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.name").value("healthwatch.report.duration"));
    }
}
