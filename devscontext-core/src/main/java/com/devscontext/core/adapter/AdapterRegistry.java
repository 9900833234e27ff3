package com.devscontext.core.adapter;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * The enabled adapters of this process, built once at startup and passed to
 * the fetch coordinator, the pipeline and the orchestrator.
 */
@Component
@Slf4j
public class AdapterRegistry {

    private final Map<String, SourceAdapter> adapters = new LinkedHashMap<>();

    @Autowired
    public AdapterRegistry(ObjectProvider<SourceAdapter> adapterProvider) {
        this(adapterProvider.orderedStream().collect(Collectors.toList()));
    }

    public AdapterRegistry(List<SourceAdapter> adapterList) {
        for (SourceAdapter adapter : adapterList) {
            if (adapters.putIfAbsent(adapter.getName(), adapter) != null) {
                throw new IllegalStateException("Duplicate adapter name: " + adapter.getName());
            }
        }
        long primaries = adapters.values().stream().filter(SourceAdapter::isPrimary).count();
        if (primaries > 1) {
            throw new IllegalStateException("At most one primary adapter may be enabled, found " + primaries);
        }
        log.info("[REGISTRY] Adapters registered | count={} | names={}", adapters.size(), adapters.keySet());
    }

    public List<SourceAdapter> getAdapters() {
        return List.copyOf(adapters.values());
    }

    public Optional<SourceAdapter> get(String name) {
        return Optional.ofNullable(adapters.get(name));
    }

    public Optional<SourceAdapter> getPrimary() {
        return adapters.values().stream().filter(SourceAdapter::isPrimary).findFirst();
    }

    public Optional<IssueTracker> getIssueTracker() {
        return adapters.values().stream()
            .filter(IssueTracker.class::isInstance)
            .map(IssueTracker.class::cast)
            .findFirst();
    }

    public <T extends SourceAdapter> Optional<T> find(Class<T> type) {
        return adapters.values().stream().filter(type::isInstance).map(type::cast).findFirst();
    }

    @PreDestroy
    public void closeAll() {
        for (SourceAdapter adapter : adapters.values()) {
            try {
                adapter.close();
            } catch (Exception e) {
                log.warn("[REGISTRY] Failed to close adapter | name={} | error={}", adapter.getName(), e.getMessage());
            }
        }
    }
}
