package com.devscontext.api.controller;

import com.devscontext.common.util.TextUtils;
import com.devscontext.core.orchestrator.ContextOrchestrator;
import com.devscontext.core.orchestrator.HealthStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import javax.sql.DataSource;
import java.sql.Connection;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Liveness plus per-adapter health. A failing adapter degrades the status
 * but never fails the request: the service still answers from whatever
 * sources remain.
 */
@RestController
@RequestMapping("/api/v1/health")
@Slf4j
public class HealthController {

    private final ContextOrchestrator orchestrator;
    private final DataSource dataSource;
    private final Instant startTime = Instant.now();

    public HealthController(ContextOrchestrator orchestrator, DataSource dataSource) {
        this.orchestrator = orchestrator;
        this.dataSource = dataSource;
    }

    @GetMapping
    public ResponseEntity<Map<String, Object>> health() {
        HealthStatus status = orchestrator.healthCheck();

        Map<String, Object> response = new LinkedHashMap<>();
        response.put("status", status.isHealthy() ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "devscontext");
        response.put("adapters", status.getAdapters());

        return ResponseEntity.ok(response);
    }

    /**
     * Adds database connectivity, uptime and dedup cache counters.
     */
    @GetMapping("/detailed")
    public ResponseEntity<Map<String, Object>> detailedHealth() {
        HealthStatus status = orchestrator.healthCheck();
        Map<String, Object> dbHealth = checkDatabaseHealth();

        Map<String, Object> response = new LinkedHashMap<>();
        boolean up = status.isHealthy() && "UP".equals(dbHealth.get("status"));
        response.put("status", up ? "UP" : "DEGRADED");
        response.put("timestamp", Instant.now().toString());
        response.put("service", "devscontext");
        response.put("uptime", TextUtils.formatDuration(Instant.now().toEpochMilli() - startTime.toEpochMilli()));
        response.put("adapters", status.getAdapters());
        response.put("database", dbHealth);
        response.put("cache", orchestrator.cacheStats());

        return ResponseEntity.ok(response);
    }

    @GetMapping("/ping")
    public ResponseEntity<String> ping() {
        return ResponseEntity.ok("pong");
    }

    private Map<String, Object> checkDatabaseHealth() {
        Map<String, Object> dbHealth = new LinkedHashMap<>();
        long startTime = System.currentTimeMillis();

        try (Connection connection = dataSource.getConnection()) {
            boolean valid = connection.isValid(5);
            dbHealth.put("status", valid ? "UP" : "DOWN");
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - startTime);
            dbHealth.put("database", connection.getMetaData().getDatabaseProductName());
        } catch (Exception e) {
            log.warn("[API] Database health check failed | error={}", e.getMessage());
            dbHealth.put("status", "DOWN");
            dbHealth.put("error", e.getMessage());
            dbHealth.put("responseTimeMs", System.currentTimeMillis() - startTime);
        }

        return dbHealth;
    }
}
