package com.zzf.clawcontrol.transport;

/**
 * One open (or opening) socket. Only the connection session writes to it.
 */
public interface Transport {

    void sendText(String text);

    void close(int code, String reason);
}
