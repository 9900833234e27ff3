package com.devscontext.core.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

/**
 * What one adapter returned for one task. Failed fetches carry {@code error}
 * and an empty {@code rawText}.
 */
@Value
@Builder(toBuilder = true)
public class SourceContext {

    String sourceName;
    SourceType sourceType;

    /** Typed payload, e.g. {@code JiraContext}. May be null. */
    Object data;

    @Builder.Default
    String rawText = "";

    @Builder.Default
    Map<String, Object> metadata = Map.of();

    Instant fetchedAt;

    String error;

    public static SourceContext failure(String sourceName, SourceType sourceType, String error, Instant fetchedAt) {
        return SourceContext.builder()
            .sourceName(sourceName)
            .sourceType(sourceType)
            .error(error)
            .fetchedAt(fetchedAt)
            .build();
    }

    public static SourceContext empty(String sourceName, SourceType sourceType, Instant fetchedAt) {
        return SourceContext.builder()
            .sourceName(sourceName)
            .sourceType(sourceType)
            .fetchedAt(fetchedAt)
            .build();
    }

    public boolean hasError() {
        return error != null;
    }

    public boolean isEmpty() {
        return rawText == null || rawText.isBlank();
    }

    /** True when the source succeeded and produced text worth synthesizing. */
    public boolean hasContent() {
        return !hasError() && !isEmpty();
    }

    public <T> Optional<T> dataAs(Class<T> type) {
        return type.isInstance(data) ? Optional.of(type.cast(data)) : Optional.empty();
    }
}
