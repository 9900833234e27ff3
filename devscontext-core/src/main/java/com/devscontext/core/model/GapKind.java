package com.devscontext.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum GapKind {

    ACCEPTANCE_CRITERIA("No acceptance criteria defined"),
    COMPONENTS("No components assigned"),
    LABELS("No labels assigned"),
    MEETINGS("No related meetings found"),
    DOCUMENTATION("No matching documentation found"),
    LINKED_ISSUES("No linked issues"),
    // Reported by the gap detection pass, free-form description
    DETECTED(null);

    private final String defaultDescription;

    public static GapKind fromDescription(String description) {
        for (GapKind kind : values()) {
            if (kind.defaultDescription != null && kind.defaultDescription.equals(description)) {
                return kind;
            }
        }
        return DETECTED;
    }
}
