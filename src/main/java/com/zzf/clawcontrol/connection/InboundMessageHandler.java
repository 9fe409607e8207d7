package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.protocol.UserMessageFrame;

@FunctionalInterface
public interface InboundMessageHandler {

    void onUserMessage(UserMessageFrame message);
}
