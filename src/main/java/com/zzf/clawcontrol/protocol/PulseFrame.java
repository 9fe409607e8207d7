package com.zzf.clawcontrol.protocol;

import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.ToString;

@Getter
@ToString
@RequiredArgsConstructor
public final class PulseFrame implements OutboundFrame {
    private final String content;

    @Override
    public String getType() {
        return FrameTypes.PULSE;
    }
}
