package com.devscontext.api.controller;

import com.devscontext.api.dto.request.SearchRequest;
import com.devscontext.api.dto.response.SearchResponse;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.ModelAttribute;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/v1/search")
@RequiredArgsConstructor
@Slf4j
public class SearchController {

    private final ContextOrchestrator orchestrator;

    @GetMapping
    public ResponseEntity<SearchResponse> search(@Valid @ModelAttribute SearchRequest request) {
        long startTime = System.currentTimeMillis();
        List<SearchResult> results = orchestrator.searchContext(request.getQ(), request.getMaxResults());
        long duration = System.currentTimeMillis() - startTime;
        log.info("[API] Search served | results={} | durationMs={}", results.size(), duration);

        return ResponseEntity.ok(SearchResponse.builder()
            .query(request.getQ())
            .totalResults(results.size())
            .results(results.stream().map(SearchResponse.ResultInfo::from).toList())
            .durationMs(duration)
            .build());
    }
}
