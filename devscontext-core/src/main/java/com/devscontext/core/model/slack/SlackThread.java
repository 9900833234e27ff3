package com.devscontext.core.model.slack;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class SlackThread {

    SlackMessage parent;

    @Builder.Default
    List<SlackMessage> replies = List.of();

    @Builder.Default
    List<String> participants = List.of();

    @Builder.Default
    List<String> decisions = List.of();

    @Builder.Default
    List<String> actionItems = List.of();
}
