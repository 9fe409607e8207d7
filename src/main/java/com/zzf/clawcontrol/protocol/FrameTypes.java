package com.zzf.clawcontrol.protocol;

/**
 * Wire discriminants.
 */
public final class FrameTypes {

    public static final String CONNECTED = "connected";
    public static final String AGENT_TEXT = "agent_text";
    public static final String AGENT_TYPING = "agent_typing";
    public static final String AGENT_DONE = "agent_done";
    public static final String ERROR = "error";
    public static final String PULSE = "pulse";
    public static final String THREAD_LIST_REQUEST = "thread_list_request";
    public static final String THREAD_INFO_REQUEST = "thread_info_request";
    public static final String FILE_SYNC = "file_sync";
    public static final String FILE_SNAPSHOT = "file_snapshot";

    public static final String USER_MESSAGE = "user_message";
    public static final String THREAD_LIST = "thread_list";
    public static final String RESPONSE = "response";
    public static final String FILE_SYNC_PUSH = "file_sync_push";
    public static final String FILE_SNAPSHOT_ACK = "file_snapshot_ack";

    private FrameTypes() {
    }
}
