package com.devscontext.common.util;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

class SourceDataHasherTest {

    @Test
    void hashIgnoresWhitespaceAndCase() {
        String first = SourceDataHasher.hash(List.of("Ticket PROJ-1\n\nRetry   webhooks", "Meeting notes"));
        String second = SourceDataHasher.hash(List.of("  ticket proj-1 retry webhooks ", "MEETING NOTES"));

        assertEquals(first, second);
        assertEquals(64, first.length());
    }

    @Test
    void hashChangesWhenContentChanges() {
        String before = SourceDataHasher.hash(List.of("Ticket PROJ-1", "status: open"));
        String after = SourceDataHasher.hash(List.of("Ticket PROJ-1", "status: done"));

        assertNotEquals(before, after);
    }

    @Test
    void hashSkipsNullAndEmptyEntries() {
        String withGaps = SourceDataHasher.hash(Arrays.asList("a", null, "", "b"));
        String compact = SourceDataHasher.hash(List.of("a", "b"));

        assertEquals(compact, withGaps);
    }
}
