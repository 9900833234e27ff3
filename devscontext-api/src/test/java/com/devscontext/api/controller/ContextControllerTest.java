package com.devscontext.api.controller;

import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.content;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devscontext.core.model.Gap;
import com.devscontext.core.model.GapKind;
import com.devscontext.core.model.SynthesizedContext;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

@WebMvcTest(controllers = ContextController.class)
class ContextControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ContextOrchestrator orchestrator;

    private static SynthesizedContext context(boolean prebuilt) {
        return SynthesizedContext.builder()
            .taskId("PROJ-123")
            .body("## Task: PROJ-123\n\nRetry webhooks.")
            .sourcesUsed(List.of("jira:PROJ-123", "docs:docs/architecture/payments.md"))
            .qualityScore(0.7)
            .gaps(List.of(Gap.of(GapKind.MEETINGS)))
            .builtAt(Instant.parse("2026-03-01T10:00:00Z"))
            .prebuilt(prebuilt)
            .build();
    }

    @Test
    void returnsSynthesizedContext() throws Exception {
        when(orchestrator.getTaskContext("PROJ-123", false)).thenReturn(context(true));

        mvc.perform(get("/api/v1/context/PROJ-123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.taskId").value("PROJ-123"))
            .andExpect(jsonPath("$.qualityScore").value(0.7))
            .andExpect(jsonPath("$.prebuilt").value(true))
            .andExpect(jsonPath("$.sourcesUsed[0]").value("jira:PROJ-123"))
            .andExpect(jsonPath("$.gaps[0].kind").value("MEETINGS"))
            .andExpect(jsonPath("$.gaps[0].description").value("No related meetings found"));
    }

    @Test
    void refreshIsPassedThrough() throws Exception {
        when(orchestrator.getTaskContext(eq("PROJ-123"), anyBoolean())).thenReturn(context(false));

        mvc.perform(get("/api/v1/context/PROJ-123").param("refresh", "true"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.prebuilt").value(false));

        verify(orchestrator).getTaskContext("PROJ-123", true);
    }

    @Test
    void markdownEndpointReturnsBodyOnly() throws Exception {
        when(orchestrator.getTaskContext("PROJ-123", false)).thenReturn(context(true));

        mvc.perform(get("/api/v1/context/PROJ-123/markdown"))
            .andExpect(status().isOk())
            .andExpect(content().string("## Task: PROJ-123\n\nRetry webhooks."));
    }

    @Test
    void invalidArgumentMapsToBadRequest() throws Exception {
        when(orchestrator.getTaskContext(eq("PROJ-0"), anyBoolean()))
            .thenThrow(new IllegalArgumentException("Unknown task id format"));

        mvc.perform(get("/api/v1/context/PROJ-0"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.status").value(400))
            .andExpect(jsonPath("$.error").value("Unknown task id format"));
    }

    @Test
    void unexpectedFailureMapsToServerError() throws Exception {
        when(orchestrator.getTaskContext("PROJ-9", false)).thenThrow(new IllegalStateException("boom"));

        mvc.perform(get("/api/v1/context/PROJ-9"))
            .andExpect(status().isInternalServerError())
            .andExpect(jsonPath("$.message").value("An unexpected error occurred"))
            .andExpect(jsonPath("$.path").value("/api/v1/context/PROJ-9"));
    }

    @Test
    void invalidatesOneOrAllEntries() throws Exception {
        when(orchestrator.invalidateCache("PROJ-123")).thenReturn(true);
        when(orchestrator.invalidateCache()).thenReturn(3);

        mvc.perform(delete("/api/v1/context/PROJ-123"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invalidated").value(true));
        mvc.perform(delete("/api/v1/context"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.invalidated").value(3));
    }
}
