package io.github.samzhu.reach.controller;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import io.github.samzhu.reach.document.Alert;
import io.github.samzhu.reach.exception.AlertNotFoundException;
import io.github.samzhu.reach.service.AlertService;

class AlertApiControllerTest {

    private static final Instant NOW = Instant.parse("2025-01-15T06:30:00Z");

    private AlertService alertService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        alertService = mock(AlertService.class);
        mockMvc = MockMvcBuilders.standaloneSetup(new AlertApiController(alertService)).build();
    }

    private static Alert alert(boolean acknowledged) {
        return new Alert("a1", "vol", "web", "pageimpressions", LocalDate.of(2025, 1, 14), "warning",
            2.3, 0.17, 1000.0, 30.0, 1170.0, 8, true, "warning: 17.0% above median (z = +2.30)",
            acknowledged, acknowledged ? "bob" : null, acknowledged ? NOW : null, null, NOW);
    }

    @Test
    void acknowledgeShouldReturnUpdatedAlert() throws Exception {
        when(alertService.acknowledge("a1", "bob")).thenReturn(alert(true));

        mockMvc.perform(put("/api/v1/alerts/a1/acknowledge")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"acknowledgedBy\":\"bob\"}"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.acknowledged").value(true))
            .andExpect(jsonPath("$.acknowledgedBy").value("bob"));
    }

    @Test
    void acknowledgeUnknownAlertShouldReturn404() throws Exception {
        when(alertService.acknowledge("missing", "bob")).thenThrow(new AlertNotFoundException("missing"));

        mockMvc.perform(put("/api/v1/alerts/missing/acknowledge")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"acknowledgedBy\":\"bob\"}"))
            .andExpect(status().isNotFound());
    }

    @Test
    void acknowledgeWithoutUserShouldReturn400() throws Exception {
        mockMvc.perform(put("/api/v1/alerts/a1/acknowledge")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"acknowledgedBy\":\"\"}"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void recentAlertsShouldRejectNonPositiveDays() throws Exception {
        mockMvc.perform(get("/api/v1/alerts/recent").param("days", "0"))
            .andExpect(status().isBadRequest());
    }

    @Test
    void unacknowledgedAlertsShouldBeListed() throws Exception {
        when(alertService.getUnacknowledgedAlerts()).thenReturn(List.of(alert(false)));

        mockMvc.perform(get("/api/v1/alerts/unacknowledged"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].id").value("a1"))
            .andExpect(jsonPath("$[0].severity").value("warning"));
    }
}
