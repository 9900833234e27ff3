package com.devscontext.common.exception;

public class ConfigurationException extends DevsContextException {

    public ConfigurationException(String message) {
        super(message);
    }
}
