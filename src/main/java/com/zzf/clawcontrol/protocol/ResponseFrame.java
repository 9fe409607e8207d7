package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Reply to a {@link RequestFrame}. {@link #getPayload()} is the whole frame, so
 * request-specific fields ({@code threads}, {@code thread}, ...) are read from it.
 */
@Getter
@RequiredArgsConstructor
public final class ResponseFrame implements InboundFrame {
    private final String requestId;
    private final boolean ok;
    private final String error;
    private final ObjectNode payload;

    @Override
    public String getType() {
        return FrameTypes.RESPONSE;
    }

    @Override
    public String toString() {
        return "ResponseFrame(requestId=" + requestId + ", ok=" + ok + ")";
    }
}
