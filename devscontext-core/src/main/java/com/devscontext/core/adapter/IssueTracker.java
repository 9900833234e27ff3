package com.devscontext.core.adapter;

import java.time.Instant;
import java.util.List;

/**
 * Query side of the issue tracker used by the source watcher.
 */
public interface IssueTracker {

    List<TrackedIssue> findIssues(String status, List<String> projects, int maxResults);

    /**
     * An issue currently in the trigger status. {@code updated} is the
     * tracker's last-modified time and serves as a cheap freshness check.
     */
    record TrackedIssue(String key, Instant updated) {
    }
}
