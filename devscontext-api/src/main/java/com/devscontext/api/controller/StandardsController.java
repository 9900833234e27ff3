package com.devscontext.api.controller;

import com.devscontext.api.dto.response.StandardsResponse;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/v1/standards")
@RequiredArgsConstructor
public class StandardsController {

    private final ContextOrchestrator orchestrator;

    @GetMapping
    public ResponseEntity<StandardsResponse> getStandards(@RequestParam(required = false) String area) {
        return ResponseEntity.ok(new StandardsResponse(area, orchestrator.getStandards(area)));
    }
}
