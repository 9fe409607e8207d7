package com.zzf.clawcontrol.protocol;

/**
 * A frame could not be encoded, or an inbound text is not a frame this client understands.
 */
public class ProtocolException extends Exception {

    public ProtocolException(String message) {
        super(message);
    }

    public ProtocolException(String message, Throwable cause) {
        super(message, cause);
    }
}
