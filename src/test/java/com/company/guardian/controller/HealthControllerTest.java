package com.company.guardian.controller;

import com.company.guardian.alerting.AlertDispatcher;
import com.company.guardian.domain.TrackedWorkload;
import com.company.guardian.domain.WorkloadRef;
import com.company.guardian.support.MutableClock;
import com.company.guardian.workload.InMemoryTrackedWorkloadProvider;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Instant;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class HealthControllerTest {

    @Test
    void reportsDispatcherAndRegistryCounts() throws Exception {
        AlertDispatcher dispatcher = mock(AlertDispatcher.class);
        when(dispatcher.getActiveCount()).thenReturn(2);
        when(dispatcher.getPendingCount()).thenReturn(1);
        when(dispatcher.getAlertCount24h()).thenReturn(5);
        InMemoryTrackedWorkloadProvider provider = new InMemoryTrackedWorkloadProvider();
        provider.register(TrackedWorkload.builder().ref(WorkloadRef.of("batch", "nightly-report")).schedule("@daily").build());

        MockMvc mockMvc = MockMvcBuilders
                .standaloneSetup(new HealthController(dispatcher, provider, new MutableClock(Instant.parse("2025-01-10T12:00:00Z"))))
                .build();

        mockMvc.perform(get("/api/v1/health"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("UP"))
                .andExpect(jsonPath("$.trackedWorkloads").value(1))
                .andExpect(jsonPath("$.activeAlerts").value(2))
                .andExpect(jsonPath("$.pendingAlerts").value(1))
                .andExpect(jsonPath("$.alertsLast24h").value(5));
    }
}
