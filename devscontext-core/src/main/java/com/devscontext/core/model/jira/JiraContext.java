package com.devscontext.core.model.jira;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class JiraContext {

    JiraTicket ticket;

    @Builder.Default
    List<JiraComment> comments = List.of();

    @Builder.Default
    List<LinkedIssue> linkedIssues = List.of();
}
