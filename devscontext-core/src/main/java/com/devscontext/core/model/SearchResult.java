package com.devscontext.core.model;

import lombok.Builder;
import lombok.Value;

import java.util.Map;

@Value
@Builder
public class SearchResult {

    String sourceName;
    SourceType sourceType;
    String title;
    String excerpt;
    String url;

    /** In [0, 1]; higher is more relevant. */
    double relevanceScore;

    @Builder.Default
    Map<String, Object> metadata = Map.of();
}
