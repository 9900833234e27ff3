package com.devscontext.core.model.jira;

import lombok.Value;

@Value
public class LinkedIssue {
    String ticketId;
    String title;
    String status;
    /** Direction-aware link name, e.g. "blocks" or "is blocked by". */
    String linkType;
}
