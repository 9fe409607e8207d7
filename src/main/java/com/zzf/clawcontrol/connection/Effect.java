package com.zzf.clawcontrol.connection;

/**
 * Side effects requested by {@link ConnectionStateMachine}; the session performs them in order.
 */
public enum Effect {
    OPEN_TRANSPORT,
    SEND_HANDSHAKE,
    CLOSE_TRANSPORT,
    SCHEDULE_RECONNECT,
    CANCEL_RECONNECT,
    RETIRE
}
