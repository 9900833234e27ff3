package com.devscontext.api.controller;

import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

@WebMvcTest(controllers = SearchController.class)
class SearchControllerTest {

    @Autowired
    MockMvc mvc;

    @MockBean
    ContextOrchestrator orchestrator;

    @Test
    void returnsRankedResults() throws Exception {
        when(orchestrator.searchContext("webhook", 5)).thenReturn(List.of(
            SearchResult.builder().sourceName("jira").sourceType(SourceType.ISSUE_TRACKER)
                .title("[PROJ-1] Webhook retries").excerpt("...").relevanceScore(1.0).build(),
            SearchResult.builder().sourceName("local_docs").sourceType(SourceType.DOCUMENTATION)
                .title("Webhook processing (docs/architecture/payments.md)").excerpt("...").relevanceScore(0.5).build()));

        mvc.perform(get("/api/v1/search").param("q", "webhook").param("maxResults", "5"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalResults").value(2))
            .andExpect(jsonPath("$.results[0].source").value("jira"))
            .andExpect(jsonPath("$.results[1].sourceType").value("DOCUMENTATION"));
    }

    @Test
    void defaultsToTenResults() throws Exception {
        when(orchestrator.searchContext("webhook", 10)).thenReturn(List.of());

        mvc.perform(get("/api/v1/search").param("q", "webhook"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.totalResults").value(0));

        verify(orchestrator).searchContext("webhook", 10);
    }

    @Test
    void rejectsMissingQueryAndOversizedLimit() throws Exception {
        mvc.perform(get("/api/v1/search"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message").value("Validation failed"));
        mvc.perform(get("/api/v1/search").param("q", "webhook").param("maxResults", "500"))
            .andExpect(status().isBadRequest());

        verify(orchestrator, never()).searchContext(anyString(), anyInt());
    }
}
