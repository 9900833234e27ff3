package com.devscontext.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root of the DevsContext exception hierarchy. The optional details map is
 * carried into log lines and API error bodies.
 */
public class DevsContextException extends RuntimeException {

    private final Map<String, Object> details;

    public DevsContextException(String message) {
        this(message, null, null);
    }

    public DevsContextException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public DevsContextException(String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.details = details == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
