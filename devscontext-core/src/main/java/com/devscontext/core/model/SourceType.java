package com.devscontext.core.model;

public enum SourceType {
    ISSUE_TRACKER,
    MEETING,
    DOCUMENTATION,
    COMMUNICATION
}
