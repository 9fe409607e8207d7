package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class UserMessageFrame implements InboundFrame {
    @Builder.Default
    private String type = FrameTypes.USER_MESSAGE;
    private String id;
    private String sessionId;
    private String threadId;
    private String content;
    private String noteContext;
    // passed through untouched to the dispatcher
    private JsonNode history;

    public boolean hasContent() {
        return content != null && !content.isEmpty();
    }
}
