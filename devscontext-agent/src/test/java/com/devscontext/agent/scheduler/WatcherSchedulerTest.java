package com.devscontext.agent.scheduler;

import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.devscontext.common.exception.StorageException;
import com.devscontext.core.storage.PrebuiltContextStore;
import com.devscontext.core.watcher.SourceWatcher;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import java.util.List;

class WatcherSchedulerTest {

    private final SourceWatcher watcher = mock(SourceWatcher.class);
    private final PrebuiltContextStore store = mock(PrebuiltContextStore.class);

    @Test
    void pollDelegatesToWatcher() {
        when(watcher.pollOnce()).thenReturn(List.of("PROJ-1", "PROJ-2"));
        WatcherScheduler scheduler = new WatcherScheduler(watcher, store, new DefaultApplicationArguments());

        scheduler.poll();

        verify(watcher).pollOnce();
    }

    @Test
    void watcherFailureDoesNotEscapeScheduler() {
        when(watcher.pollOnce()).thenThrow(new IllegalStateException("tracker down"));
        WatcherScheduler scheduler = new WatcherScheduler(watcher, store, new DefaultApplicationArguments());

        scheduler.poll();

        verify(watcher).pollOnce();
    }

    @Test
    void onceModeLeavesCyclesToTheRunner() {
        WatcherScheduler scheduler = new WatcherScheduler(watcher, store, new DefaultApplicationArguments("--once"));

        scheduler.poll();
        scheduler.purgeExpired();

        verifyNoInteractions(watcher, store);
    }

    @Test
    void purgeSurvivesStorageFailure() {
        when(store.deleteExpired()).thenThrow(new StorageException("db locked", null));
        WatcherScheduler scheduler = new WatcherScheduler(watcher, store, new DefaultApplicationArguments());

        scheduler.purgeExpired();

        verify(store).deleteExpired();
    }

    @Test
    void shutdownStopsWatcher() {
        new WatcherScheduler(watcher, store, new DefaultApplicationArguments()).shutdown();

        verify(watcher).stop();
    }
}
