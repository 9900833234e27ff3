package com.devscontext.api.controller;

import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.storage.PrebuiltStats;
import com.devscontext.core.storage.PrebuiltSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Read access to the pre-built store plus manual cleanup. Records are only
 * ever written by the agent process.
 */
@RestController
@RequestMapping("/api/v1/prebuilt")
@RequiredArgsConstructor
@Slf4j
public class PrebuiltController {

    private final PrebuiltContextStore store;

    @GetMapping
    public ResponseEntity<List<PrebuiltSummary>> list() {
        return ResponseEntity.ok(store.listAll());
    }

    @GetMapping("/stats")
    public ResponseEntity<PrebuiltStats> stats() {
        return ResponseEntity.ok(store.stats());
    }

    @DeleteMapping("/{taskId}")
    public ResponseEntity<Map<String, Object>> delete(@PathVariable String taskId) {
        boolean deleted = store.delete(taskId);
        if (!deleted) {
            return ResponseEntity.notFound().build();
        }
        log.info("[API] Prebuilt context deleted | taskId={}", taskId);
        return ResponseEntity.ok(Map.of("taskId", taskId, "deleted", true));
    }

    @DeleteMapping("/expired")
    public ResponseEntity<Map<String, Object>> deleteExpired() {
        return ResponseEntity.ok(Map.of("deleted", store.deleteExpired()));
    }
}
