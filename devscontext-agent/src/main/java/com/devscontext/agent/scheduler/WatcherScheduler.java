package com.devscontext.agent.scheduler;

import com.devscontext.agent.OnceMode;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.watcher.SourceWatcher;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Drives the source watcher on a fixed delay, so a slow cycle pushes the next
 * one back instead of overlapping it. Also purges expired records once a day.
 */
@Component
@ConditionalOnProperty(prefix = "devscontext.agents.preprocessor", name = "enabled", havingValue = "true")
@Slf4j
public class WatcherScheduler {

    private final SourceWatcher watcher;
    private final PrebuiltContextStore store;
    private final boolean onceMode;

    public WatcherScheduler(SourceWatcher watcher, PrebuiltContextStore store, ApplicationArguments args) {
        this.watcher = watcher;
        this.store = store;
        this.onceMode = OnceMode.isActive(args);
        log.info("[AGENT] Watcher scheduler initialized | onceMode={}", onceMode);
    }

    @Scheduled(fixedDelayString = "${devscontext.agents.preprocessor.poll-interval:PT5M}", initialDelayString = "PT10S")
    public void poll() {
        if (onceMode) {
            return;
        }
        try {
            List<String> built = watcher.pollOnce();
            if (!built.isEmpty()) {
                log.info("[AGENT] Contexts pre-built | count={} | taskIds={}", built.size(), built);
            }
        } catch (Exception e) {
            log.error("[AGENT] Watcher cycle failed", e);
        }
    }

    @Scheduled(cron = "${devscontext.agents.preprocessor.cleanup-cron:0 0 3 * * *}")
    public void purgeExpired() {
        if (onceMode) {
            return;
        }
        try {
            int deleted = store.deleteExpired();
            log.info("[AGENT] Expired contexts purged | count={}", deleted);
        } catch (Exception e) {
            log.warn("[AGENT] Purge failed, will retry on next run | error={}", e.getMessage());
        }
    }

    @PreDestroy
    public void shutdown() {
        watcher.stop();
    }
}
