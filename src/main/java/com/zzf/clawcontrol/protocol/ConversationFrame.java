package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Agent-side conversation frames: {@code agent_text}, {@code agent_typing},
 * {@code agent_done} and {@code error}. {@code id} is the user message being
 * answered, {@code threadId} the thread the reply belongs to; both optional.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "id", "threadId", "content", "error"})
public final class ConversationFrame implements OutboundFrame {
    private final String type;
    private final String id;
    private final String threadId;
    private final String content;
    private final String error;

    public static ConversationFrame text(String content, String id, String threadId) {
        return new ConversationFrame(FrameTypes.AGENT_TEXT, id, threadId, content, null);
    }

    public static ConversationFrame typing(String id, String threadId) {
        return new ConversationFrame(FrameTypes.AGENT_TYPING, id, threadId, null, null);
    }

    public static ConversationFrame done(String id, String threadId) {
        return new ConversationFrame(FrameTypes.AGENT_DONE, id, threadId, null, null);
    }

    public static ConversationFrame error(String error, String id, String threadId) {
        return new ConversationFrame(FrameTypes.ERROR, id, threadId, null, error);
    }
}
