package com.devscontext.core.model;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * One {@link SourceContext} per adapter, in adapter order. Never shorter than
 * the adapter list it was fetched from.
 */
@Value
public class FetchResult {

    List<SourceContext> contexts;

    public FetchResult(List<SourceContext> contexts) {
        this.contexts = List.copyOf(contexts);
    }

    public int size() {
        return contexts.size();
    }

    public long failedCount() {
        return contexts.stream().filter(SourceContext::hasError).count();
    }

    public List<SourceContext> withContent() {
        return contexts.stream().filter(SourceContext::hasContent).collect(Collectors.toList());
    }

    public Optional<SourceContext> firstOfType(SourceType type) {
        return contexts.stream().filter(c -> c.getSourceType() == type).findFirst();
    }

    public List<String> rawTexts() {
        return contexts.stream()
            .filter(SourceContext::hasContent)
            .map(SourceContext::getRawText)
            .collect(Collectors.toList());
    }
}
