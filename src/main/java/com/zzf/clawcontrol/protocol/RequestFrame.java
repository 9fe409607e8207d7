package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;
import lombok.ToString;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request expecting a {@code response} frame with the same {@code requestId}.
 * Extra parameters are written as top-level properties next to {@code type}.
 */
@Getter
@ToString
@JsonPropertyOrder({"type", "requestId"})
public final class RequestFrame implements OutboundFrame {
    private final String type;
    private final String requestId;
    private final Map<String, Object> params;

    public RequestFrame(String type, String requestId, Map<String, ?> params) {
        this.type = type;
        this.requestId = requestId;
        Map<String, Object> copy = new LinkedHashMap<>();
        if (params != null) {
            for (Map.Entry<String, ?> entry : params.entrySet()) {
                String key = entry.getKey();
                if (key == null || "type".equals(key) || "requestId".equals(key)) {
                    continue;
                }
                copy.put(key, entry.getValue());
            }
        }
        this.params = Collections.unmodifiableMap(copy);
    }

    @JsonAnyGetter
    public Map<String, Object> getParams() {
        return params;
    }
}
