package com.zzf.clawcontrol.transport;

/**
 * Socket lifecycle callbacks. Implementations must deliver {@link #onClose} on every
 * failure path, including a failed open and an error after open, so the session
 * always learns that the socket is gone.
 */
public interface TransportListener {

    void onOpen();

    void onText(String text);

    void onClose(int code, String reason);

    void onError(Throwable error);
}
