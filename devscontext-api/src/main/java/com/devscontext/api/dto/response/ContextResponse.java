package com.devscontext.api.dto.response;

import com.devscontext.core.model.Gap;
import com.devscontext.core.model.SynthesizedContext;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ContextResponse {
    private String taskId;
    private String body;
    private List<String> sourcesUsed;
    private double qualityScore;
    private List<GapInfo> gaps;
    private Instant builtAt;
    private boolean prebuilt;

    public static ContextResponse from(SynthesizedContext context) {
        return ContextResponse.builder()
            .taskId(context.getTaskId())
            .body(context.getBody())
            .sourcesUsed(context.getSourcesUsed())
            .qualityScore(context.getQualityScore())
            .gaps(context.getGaps().stream().map(GapInfo::from).toList())
            .builtAt(context.getBuiltAt())
            .prebuilt(context.isPrebuilt())
            .build();
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class GapInfo {
        private String kind;
        private String description;

        static GapInfo from(Gap gap) {
            return new GapInfo(gap.getKind().name(), gap.getDescription());
        }
    }
}
