package com.devscontext.api.controller;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.storage.PrebuiltStats;
import com.devscontext.core.storage.PrebuiltSummary;
import com.devscontext.data.entity.ContextStatus;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

@WebMvcTest(controllers = PrebuiltController.class)
class PrebuiltControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    PrebuiltContextStore store;

    @Test
    void listsSummaries() throws Exception {
        when(store.listAll()).thenReturn(List.of(PrebuiltSummary.builder()
            .taskId("PROJ-123")
            .qualityScore(0.7)
            .builtAt(Instant.parse("2026-03-01T10:00:00Z"))
            .expiresAt(Instant.parse("2026-03-02T10:00:00Z"))
            .gapsCount(1)
            .status(ContextStatus.ACTIVE)
            .build()));

        mvc.perform(get("/api/v1/prebuilt"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$[0].taskId").value("PROJ-123"))
            .andExpect(jsonPath("$[0].gapsCount").value(1))
            .andExpect(jsonPath("$[0].status").value("ACTIVE"));
    }

    @Test
    void reportsStats() throws Exception {
        when(store.stats()).thenReturn(PrebuiltStats.builder()
            .total(3).active(2).expired(1).stale(0).avgQuality(0.8).build());

        mvc.perform(get("/api/v1/prebuilt/stats"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.total").value(3))
            .andExpect(jsonPath("$.avgQuality").value(0.8));
    }

    @Test
    void deleteReturnsNotFoundForUnknownTask() throws Exception {
        when(store.delete("PROJ-1")).thenReturn(true);
        when(store.delete("PROJ-404")).thenReturn(false);

        mvc.perform(delete("/api/v1/prebuilt/PROJ-1"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(true));
        mvc.perform(delete("/api/v1/prebuilt/PROJ-404"))
            .andExpect(status().isNotFound());
    }

    @Test
    void deletesExpiredRecords() throws Exception {
        when(store.deleteExpired()).thenReturn(4);

        mvc.perform(delete("/api/v1/prebuilt/expired"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.deleted").value(4));
    }
}
