package com.devscontext.core.model.jira;

import lombok.Value;

import java.time.Instant;

@Value
public class JiraComment {
    String author;
    String body;
    Instant created;
}
