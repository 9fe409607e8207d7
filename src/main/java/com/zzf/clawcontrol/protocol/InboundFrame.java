package com.zzf.clawcontrol.protocol;

/**
 * Frame received from the desktop app.
 */
public interface InboundFrame {

    String getType();
}
