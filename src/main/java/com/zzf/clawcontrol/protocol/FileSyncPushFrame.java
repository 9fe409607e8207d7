package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * A change made on the app side that must be applied to the local notes tree.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString(exclude = "content")
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileSyncPushFrame implements InboundFrame {
    @Builder.Default
    private String type = FrameTypes.FILE_SYNC_PUSH;
    private SyncAction action;
    private String path;
    private String content;
    private String oldPath;
    private long version;
}
