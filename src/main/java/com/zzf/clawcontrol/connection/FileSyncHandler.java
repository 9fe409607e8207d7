package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.protocol.FileSnapshotAckFrame;
import com.zzf.clawcontrol.protocol.FileSyncPushFrame;

import java.io.IOException;

/**
 * Receiver for file sync frames. Failures propagate to the session, which logs them.
 */
public interface FileSyncHandler {

    void handleServerPush(FileSyncPushFrame push) throws IOException;

    void handleSnapshotAck(FileSnapshotAckFrame ack) throws IOException;
}
