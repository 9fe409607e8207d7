package com.zzf.clawcontrol.connection;

public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED,
    CLOSING_INTENTIONAL
}
