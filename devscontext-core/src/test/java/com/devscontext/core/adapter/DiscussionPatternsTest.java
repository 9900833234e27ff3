package com.devscontext.core.adapter;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import java.util.List;

class DiscussionPatternsTest {

    @Test
    void extractsDecisions() {
        assertEquals(List.of("use exponential backoff for retries"),
            DiscussionPatterns.extractDecisions("We decided to use exponential backoff for retries"));
        assertEquals(List.of("the queue-based approach"),
            DiscussionPatterns.extractDecisions("let's go with the queue-based approach"));
    }

    @Test
    void extractsActionItems() {
        assertEquals(List.of("update the runbook tomorrow"),
            DiscussionPatterns.extractActionItems("I'll update the runbook tomorrow"));
        assertEquals(List.of("review the webhook PR"),
            DiscussionPatterns.extractActionItems("@dana can you review the webhook PR"));
    }

    @Test
    void ignoresShortAndEmptyMatches() {
        assertTrue(DiscussionPatterns.extractDecisions("agreed: ok").isEmpty());
        assertTrue(DiscussionPatterns.extractActionItems(null).isEmpty());
        assertTrue(DiscussionPatterns.extractActionItems("   ").isEmpty());
    }
}
