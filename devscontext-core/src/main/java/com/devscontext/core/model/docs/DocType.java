package com.devscontext.core.model.docs;

public enum DocType {
    ARCHITECTURE,
    STANDARDS,
    ADR,
    OTHER;

    public static DocType fromCategory(String category) {
        for (DocType type : values()) {
            if (type.name().equalsIgnoreCase(category)) {
                return type;
            }
        }
        return OTHER;
    }
}
