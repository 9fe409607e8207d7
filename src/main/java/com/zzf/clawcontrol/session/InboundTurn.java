package com.zzf.clawcontrol.session;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString(exclude = {"body", "rawBody", "history"})
public class InboundTurn {
    private final String accountId;
    private final String sessionKey;
    private final String messageId;
    private final String threadId;
    private final String sessionId;
    /** Text handed to the agent, with the note context prepended when present. */
    private final String body;
    private final String rawBody;
    private final String noteContext;
    private final JsonNode history;
    private final long receivedAt;
}
