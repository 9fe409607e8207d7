package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Getter;

import java.util.List;

/**
 * Full upload of local documents, sent once when sync starts (and again on resync).
 */
@Getter
@JsonPropertyOrder({"type", "files"})
public final class FileSnapshotFrame implements OutboundFrame {
    private final List<FileRecord> files;

    public FileSnapshotFrame(List<FileRecord> files) {
        this.files = files == null ? List.of() : List.copyOf(files);
    }

    @Override
    public String getType() {
        return FrameTypes.FILE_SNAPSHOT;
    }

    @Override
    public String toString() {
        return "FileSnapshotFrame(files=" + files.size() + ")";
    }
}
