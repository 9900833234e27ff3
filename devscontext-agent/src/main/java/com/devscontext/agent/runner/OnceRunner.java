package com.devscontext.agent.runner;

import com.devscontext.agent.OnceMode;
import com.devscontext.core.watcher.SourceWatcher;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.ExitCodeGenerator;
import org.springframework.stereotype.Component;

/**
 * {@code --once}: one watcher cycle for cron jobs and CI, then the
 * application exits with 0 on success or 1 when the cycle blew up.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class OnceRunner implements ApplicationRunner, ExitCodeGenerator {

    private final SourceWatcher watcher;

    private int exitCode = 0;

    @Override
    public void run(ApplicationArguments args) {
        if (!OnceMode.isActive(args)) {
            return;
        }
        long startTime = System.currentTimeMillis();
        try {
            int built = watcher.runOnce();
            log.info("[AGENT] Single cycle finished | built={} | durationMs={}", built, System.currentTimeMillis() - startTime);
        } catch (Exception e) {
            exitCode = 1;
            log.error("[AGENT] Single cycle failed", e);
        }
    }

    @Override
    public int getExitCode() {
        return exitCode;
    }
}
