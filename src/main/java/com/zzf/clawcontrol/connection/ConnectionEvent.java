package com.zzf.clawcontrol.connection;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class ConnectionEvent {

    public enum Kind {
        CONNECT_REQUESTED,
        OPENED,
        CLOSED,
        AUTH_REJECTED,
        TRANSPORT_ERROR,
        DISCONNECT_REQUESTED,
        RECONNECT_DUE
    }

    private final Kind kind;
    private final int closeCode;
    private final String reason;
    private final int consecutiveAuthRejections;

    public static ConnectionEvent connectRequested() {
        return new ConnectionEvent(Kind.CONNECT_REQUESTED, 0, null, 0);
    }

    public static ConnectionEvent opened() {
        return new ConnectionEvent(Kind.OPENED, 0, null, 0);
    }

    public static ConnectionEvent closed(int code, String reason) {
        return new ConnectionEvent(Kind.CLOSED, code, reason, 0);
    }

    public static ConnectionEvent authRejected(int consecutiveRejections, String reason) {
        return new ConnectionEvent(Kind.AUTH_REJECTED, 0, reason, consecutiveRejections);
    }

    public static ConnectionEvent transportError(String reason) {
        return new ConnectionEvent(Kind.TRANSPORT_ERROR, 0, reason, 0);
    }

    public static ConnectionEvent disconnectRequested() {
        return new ConnectionEvent(Kind.DISCONNECT_REQUESTED, 0, null, 0);
    }

    public static ConnectionEvent reconnectDue() {
        return new ConnectionEvent(Kind.RECONNECT_DUE, 0, null, 0);
    }
}
