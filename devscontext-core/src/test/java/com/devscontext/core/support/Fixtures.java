package com.devscontext.core.support;

import com.devscontext.core.model.SourceContext;
import com.devscontext.core.model.SourceType;
import com.devscontext.core.model.docs.DocSection;
import com.devscontext.core.model.docs.DocType;
import com.devscontext.core.model.docs.DocsContext;
import com.devscontext.core.model.jira.JiraContext;
import com.devscontext.core.model.jira.JiraTicket;

import java.time.Instant;
import java.util.List;

public final class Fixtures {

    private Fixtures() {}

    /** Payments ticket with acceptance criteria, one component, one label and no links. */
    public static SourceContext paymentsTicket(String taskId) {
        JiraTicket ticket = JiraTicket.builder()
            .ticketId(taskId)
            .title("Add retry logic to payment webhook handler")
            .description("Webhooks from the payment provider are dropped on timeouts.")
            .status("Ready for Development")
            .acceptanceCriteria("- Failed webhooks are retried three times")
            .components(List.of("payments"))
            .labels(List.of("webhook"))
            .updated(Instant.parse("2026-03-01T10:00:00Z"))
            .build();
        return SourceContext.builder()
            .sourceName("jira")
            .sourceType(SourceType.ISSUE_TRACKER)
            .data(JiraContext.builder().ticket(ticket).build())
            .rawText("# [" + taskId + "] Add retry logic to payment webhook handler")
            .build();
    }

    public static SourceContext architectureDocs() {
        DocSection section = DocSection.builder()
            .filePath("docs/architecture/payments.md")
            .sectionTitle("Webhook processing")
            .content("Webhooks are queued before processing.")
            .docType(DocType.ARCHITECTURE)
            .build();
        return SourceContext.builder()
            .sourceName("local_docs")
            .sourceType(SourceType.DOCUMENTATION)
            .data(new DocsContext(List.of(section)))
            .rawText("## Webhook processing\n*Source: docs/architecture/payments.md* [architecture]")
            .build();
    }

    public static SourceContext emptyMeetings() {
        return SourceContext.empty("fireflies", SourceType.MEETING, Instant.EPOCH);
    }
}
