package com.zzf.clawcontrol.connection;

/**
 * The app answered a request with {@code ok: false}, or with a payload missing the expected data.
 */
public class RemoteRequestException extends RuntimeException {

    public RemoteRequestException(String message) {
        super(message);
    }

    public RemoteRequestException(String message, Throwable cause) {
        super(message, cause);
    }
}
