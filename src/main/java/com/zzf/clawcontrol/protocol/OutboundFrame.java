package com.zzf.clawcontrol.protocol;

/**
 * Frame sent to the desktop app. Serialized by {@link FrameCodec}; the {@code type}
 * property is the discriminant the app switches on.
 */
public interface OutboundFrame {

    String getType();
}
