package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * A local change reported to the app.
 */
@Getter
@ToString(exclude = "content")
@AllArgsConstructor(access = AccessLevel.PRIVATE)
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonPropertyOrder({"type", "action", "path", "content"})
public final class FileSyncFrame implements OutboundFrame {
    private final SyncAction action;
    private final String path;
    private final String content;

    public static FileSyncFrame upsert(String path, String content) {
        return new FileSyncFrame(SyncAction.UPSERT, path, content);
    }

    public static FileSyncFrame delete(String path) {
        return new FileSyncFrame(SyncAction.DELETE, path, null);
    }

    @Override
    public String getType() {
        return FrameTypes.FILE_SYNC;
    }
}
