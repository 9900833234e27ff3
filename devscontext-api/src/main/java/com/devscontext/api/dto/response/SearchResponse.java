package com.devscontext.api.dto.response;

import com.devscontext.core.model.SearchResult;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SearchResponse {
    private String query;
    private int totalResults;
    private List<ResultInfo> results;
    private long durationMs;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ResultInfo {
        private String source;
        private String sourceType;
        private String title;
        private String excerpt;
        private String url;
        private double relevance;
        private Map<String, Object> metadata;

        public static ResultInfo from(SearchResult result) {
            return ResultInfo.builder()
                .source(result.getSourceName())
                .sourceType(result.getSourceType().name())
                .title(result.getTitle())
                .excerpt(result.getExcerpt())
                .url(result.getUrl())
                .relevance(result.getRelevanceScore())
                .metadata(result.getMetadata())
                .build();
        }
    }
}
