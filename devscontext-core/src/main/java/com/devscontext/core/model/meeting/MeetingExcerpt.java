package com.devscontext.core.model.meeting;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class MeetingExcerpt {

    String meetingTitle;
    Instant meetingDate;

    @Builder.Default
    List<String> participants = List.of();

    String excerpt;

    @Builder.Default
    List<String> actionItems = List.of();

    @Builder.Default
    List<String> decisions = List.of();
}
