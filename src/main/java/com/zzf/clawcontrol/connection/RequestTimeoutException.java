package com.zzf.clawcontrol.connection;

import java.util.concurrent.TimeoutException;

public class RequestTimeoutException extends TimeoutException {
    private final String requestId;

    public RequestTimeoutException(String kind, String requestId, long timeoutMillis) {
        super("Request " + kind + " timed out after " + timeoutMillis + "ms");
        this.requestId = requestId;
    }

    public String getRequestId() {
        return requestId;
    }
}
