package com.devscontext.core.model;

import com.devscontext.core.model.jira.JiraContext;
import com.devscontext.core.model.jira.JiraTicket;
import com.devscontext.core.model.jira.LinkedIssue;
import lombok.Builder;
import lombok.Value;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The ticket metadata the quality scorer reads.
 */
@Value
@Builder(toBuilder = true)
public class TicketFields {

    public static final TicketFields EMPTY = TicketFields.builder().build();

    String title;
    String acceptanceCriteria;

    @Builder.Default
    List<String> components = List.of();

    @Builder.Default
    List<String> labels = List.of();

    @Builder.Default
    List<String> linkedIssues = List.of();

    public static TicketFields from(JiraContext context) {
        if (context == null || context.getTicket() == null) {
            return EMPTY;
        }
        JiraTicket ticket = context.getTicket();
        return TicketFields.builder()
            .title(ticket.getTitle())
            .acceptanceCriteria(ticket.getAcceptanceCriteria())
            .components(nullSafe(ticket.getComponents()))
            .labels(nullSafe(ticket.getLabels()))
            .linkedIssues(context.getLinkedIssues() == null ? List.of()
                : context.getLinkedIssues().stream().map(LinkedIssue::getTicketId).collect(Collectors.toList()))
            .build();
    }

    public static TicketFields from(SourceContext primary) {
        if (primary == null) {
            return EMPTY;
        }
        return primary.dataAs(JiraContext.class).map(TicketFields::from).orElse(EMPTY);
    }

    private static List<String> nullSafe(List<String> values) {
        return values == null ? List.of() : values;
    }
}
