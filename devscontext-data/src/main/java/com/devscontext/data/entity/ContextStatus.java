package com.devscontext.data.entity;

public enum ContextStatus {
    ACTIVE,
    EXPIRED,
    STALE
}
