package com.devscontext.core.model.jira;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

@Value
@Builder
public class JiraTicket {

    String ticketId;
    String title;
    String description;
    String status;
    String assignee;

    @Builder.Default
    List<String> labels = List.of();

    @Builder.Default
    List<String> components = List.of();

    String acceptanceCriteria;
    Double storyPoints;
    String sprint;
    Instant created;
    Instant updated;
}
