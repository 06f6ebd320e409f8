package com.keystone.dispatch.api;

import com.keystone.core.health.HealthCheckService;
import com.keystone.core.health.HealthStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.test.context.TestPropertySource;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@WebMvcTest(HealthController.class)
@TestPropertySource(properties = "spring.main.web-application-type=servlet")
class HealthControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockitoBean
    private HealthCheckService healthCheckService;

    private static HealthStatus componentStatus(String component, HealthStatus.Status s) {
        return new HealthStatus(component, s, component + " " + s, Map.of());
    }

    @Test
    @DisplayName("all components UP returns 200")
    void allUp() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                new HealthStatus("agents", HealthStatus.Status.UP, "2 agents healthy", Map.of("healthy", "2")),
                componentStatus("database", HealthStatus.Status.UP)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.components.agents.metadata.healthy").value("2"))
                .andExpect(jsonPath("$.components.database.metadata").doesNotExist());
    }

    @Test
    @DisplayName("a DOWN component returns 503")
    void downIsUnavailable() throws Exception {
        when(healthCheckService.checkAll()).thenReturn(List.of(
                componentStatus("agents", HealthStatus.Status.DEGRADED),
                componentStatus("database", HealthStatus.Status.DOWN)));

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("DOWN"));
    }

    @Test
    @DisplayName("DEGRADED without DOWN stays 200")
    void degradedIsStillServing() {
        assertEquals(HealthStatus.Status.DEGRADED, HealthStatus.rollUp(List.of(
                componentStatus("agents", HealthStatus.Status.UP),
                componentStatus("circuits", HealthStatus.Status.DEGRADED))));
        assertEquals(HealthStatus.Status.UP, HealthStatus.rollUp(List.of()));
    }
}
