package com.devscontext.agent.runner;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.devscontext.core.watcher.SourceWatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

class OnceRunnerTest {

    private final SourceWatcher watcher = mock(SourceWatcher.class);

    @Test
    void runsSingleCycleWithOnceOption() {
        when(watcher.runOnce()).thenReturn(3);
        OnceRunner runner = new OnceRunner(watcher);

        runner.run(new DefaultApplicationArguments("--once"));

        verify(watcher).runOnce();
        assertEquals(0, runner.getExitCode());
    }

    @Test
    void idleWithoutOnceOption() {
        OnceRunner runner = new OnceRunner(watcher);

        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(watcher);
    }

    @Test
    void failedCycleSetsExitCode() {
        when(watcher.runOnce()).thenThrow(new IllegalStateException("no tracker"));
        OnceRunner runner = new OnceRunner(watcher);

        runner.run(new DefaultApplicationArguments("--once"));

        assertEquals(1, runner.getExitCode());
    }
}
