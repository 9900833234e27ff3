package com.devscontext.common.exception;

import java.util.Map;

public class SynthesisException extends DevsContextException {

    public SynthesisException(String message) {
        super(message);
    }

    public SynthesisException(String message, Throwable cause) {
        super(message, cause);
    }

    public SynthesisException(String message, Map<String, Object> details, Throwable cause) {
        super(message, details, cause);
    }
}
