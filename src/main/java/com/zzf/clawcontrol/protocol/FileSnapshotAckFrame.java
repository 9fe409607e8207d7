package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.util.ArrayList;
import java.util.List;

/**
 * The app's answer to a snapshot: documents it holds that were missing locally.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class FileSnapshotAckFrame implements InboundFrame {
    private String type = FrameTypes.FILE_SNAPSHOT_ACK;
    private List<Update> updates = new ArrayList<>();

    public FileSnapshotAckFrame(List<Update> updates) {
        this.updates = updates;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @ToString(exclude = "content")
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class Update {
        private String path;
        private String content;
        private long version;
        private SyncAction action;
    }
}
