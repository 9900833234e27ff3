package com.devscontext.core.adapter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.devscontext.core.model.SourceType;
import com.devscontext.core.support.FakeAdapter;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

class AdapterRegistryTest {

    @Test
    void keepsRegistrationOrderAndFindsPrimary() {
        FakeAdapter jira = new FakeAdapter("jira", SourceType.ISSUE_TRACKER).primary();
        FakeAdapter docs = new FakeAdapter("local_docs", SourceType.DOCUMENTATION);

        AdapterRegistry registry = new AdapterRegistry(List.of(jira, docs));

        assertThat(registry.getAdapters()).containsExactly(jira, docs);
        assertEquals(jira, registry.getPrimary().orElseThrow());
        assertEquals(docs, registry.get("local_docs").orElseThrow());
        assertEquals(jira, registry.find(FakeAdapter.class).orElseThrow());
        assertTrue(registry.getIssueTracker().isEmpty());
    }

    @Test
    void rejectsDuplicateNames() {
        IllegalStateException e = assertThrows(IllegalStateException.class, () -> new AdapterRegistry(List.of(
            new FakeAdapter("slack", SourceType.COMMUNICATION),
            new FakeAdapter("slack", SourceType.COMMUNICATION))));

        assertEquals("Duplicate adapter name: slack", e.getMessage());
    }

    @Test
    void rejectsTwoPrimaries() {
        assertThrows(IllegalStateException.class, () -> new AdapterRegistry(List.of(
            new FakeAdapter("jira", SourceType.ISSUE_TRACKER).primary(),
            new FakeAdapter("linear", SourceType.ISSUE_TRACKER).primary())));
    }

    @Test
    void closeAllContinuesPastFailingAdapter() {
        AtomicInteger closed = new AtomicInteger();
        FakeAdapter failing = new FakeAdapter("broken", SourceType.MEETING) {
            @Override
            public void close() {
                throw new IllegalStateException("already closed");
            }
        };
        FakeAdapter counting = new FakeAdapter("ok", SourceType.COMMUNICATION) {
            @Override
            public void close() {
                closed.incrementAndGet();
            }
        };

        new AdapterRegistry(List.of(failing, counting)).closeAll();

        assertEquals(1, closed.get());
    }
}
