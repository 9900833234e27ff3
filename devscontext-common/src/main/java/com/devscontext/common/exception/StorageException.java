package com.devscontext.common.exception;

public class StorageException extends DevsContextException {

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
