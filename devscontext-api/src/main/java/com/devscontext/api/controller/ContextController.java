package com.devscontext.api.controller;

import com.devscontext.api.dto.response.ContextResponse;
import com.devscontext.core.model.SynthesizedContext;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Task context for coding assistants. {@code /markdown} returns the body alone
 * so it can be piped straight into a prompt.
 */
@RestController
@RequestMapping("/api/v1/context")
@RequiredArgsConstructor
@Slf4j
public class ContextController {

    private final ContextOrchestrator orchestrator;

    @GetMapping("/{taskId}")
    public ResponseEntity<ContextResponse> getTaskContext(
            @PathVariable String taskId,
            @RequestParam(defaultValue = "false") boolean refresh
    ) {
        long startTime = System.currentTimeMillis();
        SynthesizedContext context = orchestrator.getTaskContext(taskId, refresh);
        log.info("[API] Task context served | taskId={} | prebuilt={} | refresh={} | durationMs={}",
            taskId, context.isPrebuilt(), refresh, System.currentTimeMillis() - startTime);
        return ResponseEntity.ok(ContextResponse.from(context));
    }

    @GetMapping(value = "/{taskId}/markdown", produces = MediaType.TEXT_MARKDOWN_VALUE)
    public ResponseEntity<String> getTaskContextMarkdown(
            @PathVariable String taskId,
            @RequestParam(defaultValue = "false") boolean refresh
    ) {
        return ResponseEntity.ok(orchestrator.getTaskContext(taskId, refresh).getBody());
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Map<String, Object>> invalidate(@PathVariable String taskId) {
        boolean removed = orchestrator.invalidateCache(taskId);
        return ResponseEntity.ok(Map.of("taskId", taskId, "invalidated", removed));
    }

    @DeleteMapping
    public ResponseEntity<Map<String, Object>> invalidateAll() {
        int removed = orchestrator.invalidateCache();
        log.info("[API] Dedup cache cleared | entries={}", removed);
        return ResponseEntity.ok(Map.of("invalidated", removed));
    }
}
