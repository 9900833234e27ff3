package com.devscontext.common.exception;

import java.util.Map;

/**
 * A single source failed (network, auth, timeout or an unexpected response).
 */
public class AdapterException extends DevsContextException {

    private final String adapterName;

    public AdapterException(String adapterName, String message) {
        this(adapterName, message, null);
    }

    public AdapterException(String adapterName, String message, Throwable cause) {
        super(message, Map.of("adapter", adapterName), cause);
        this.adapterName = adapterName;
    }

    public String getAdapterName() {
        return adapterName;
    }
}
