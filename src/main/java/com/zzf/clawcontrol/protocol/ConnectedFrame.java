package com.zzf.clawcontrol.protocol;

/**
 * Handshake sent right after the socket opens.
 */
public final class ConnectedFrame implements OutboundFrame {

    @Override
    public String getType() {
        return FrameTypes.CONNECTED;
    }
}
