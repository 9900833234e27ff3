package com.devscontext.core.model;

import lombok.Value;

@Value
public class Gap {

    GapKind kind;
    String description;

    public static Gap of(GapKind kind) {
        return new Gap(kind, kind.getDefaultDescription());
    }

    public static Gap detected(String description) {
        return new Gap(GapKind.DETECTED, description);
    }

    /** Rebuilds a gap from its stored description. */
    public static Gap fromDescription(String description) {
        return new Gap(GapKind.fromDescription(description), description);
    }
}
