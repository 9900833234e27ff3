package com.devscontext.core.adapter;

import com.devscontext.core.model.FetchDepth;
import com.devscontext.core.model.SearchResult;
import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;

import java.util.List;

/**
 * One external system that can contribute context for a task.
 *
 * <p>Implementations own their HTTP clients and other resources and release
 * them in {@link #close()}. They may throw from {@link #fetchTaskContext};
 * the fetch coordinator turns any failure into an error entry.
 */
public interface SourceAdapter {

    String getName();

    SourceType getSourceType();

    /** Fetched first; its result is handed to adapters that need it. */
    default boolean isPrimary() {
        return false;
    }

    /** Receives the primary adapter's context (or null) as a hint. */
    default boolean needsPrimaryContext() {
        return false;
    }

    SourceContext fetchTaskContext(String taskId, SourceContext primaryHint, FetchDepth depth);

    List<SearchResult> search(String query, int maxResults);

    boolean healthCheck();

    default void close() {
    }
}
