package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.transport.CloseCodes;

import static com.zzf.clawcontrol.connection.ConnectionState.CLOSING_INTENTIONAL;
import static com.zzf.clawcontrol.connection.ConnectionState.CONNECTED;
import static com.zzf.clawcontrol.connection.ConnectionState.CONNECTING;
import static com.zzf.clawcontrol.connection.ConnectionState.DISCONNECTED;

/**
 * Pure transition function for the connection lifecycle: {@code (state, event) -> (next, effects)}.
 *
 * <p>Reconnects use a fixed delay with no retry cap. The only ways out of the retry
 * cycle are an explicit disconnect, a close carrying {@link CloseCodes#SUPERSEDED}, and
 * {@code maxAuthRejections} consecutive authentication rejections.</p>
 */
public final class ConnectionStateMachine {
    private final int maxAuthRejections;

    public ConnectionStateMachine(int maxAuthRejections) {
        this.maxAuthRejections = Math.max(1, maxAuthRejections);
    }

    public int getMaxAuthRejections() {
        return maxAuthRejections;
    }

    public Transition next(ConnectionState current, ConnectionEvent event) {
        switch (event.getKind()) {
            case CONNECT_REQUESTED:
                if (current == DISCONNECTED || current == CLOSING_INTENTIONAL) {
                    return Transition.to(CONNECTING, Effect.CANCEL_RECONNECT, Effect.OPEN_TRANSPORT);
                }
                return Transition.to(current);
            case RECONNECT_DUE:
                if (current == DISCONNECTED) {
                    return Transition.to(CONNECTING, Effect.OPEN_TRANSPORT);
                }
                return Transition.to(current);
            case OPENED:
                if (current == CONNECTING) {
                    return Transition.to(CONNECTED, Effect.SEND_HANDSHAKE);
                }
                if (current == CLOSING_INTENTIONAL) {
                    return Transition.to(current, Effect.CLOSE_TRANSPORT);
                }
                return Transition.to(current);
            case CLOSED:
                if (current != CONNECTING && current != CONNECTED) {
                    return Transition.to(current);
                }
                if (event.getCloseCode() == CloseCodes.SUPERSEDED) {
                    return Transition.to(DISCONNECTED, Effect.RETIRE);
                }
                return Transition.to(DISCONNECTED, Effect.SCHEDULE_RECONNECT);
            case AUTH_REJECTED:
                if (current != CONNECTING && current != CONNECTED) {
                    return Transition.to(current);
                }
                if (event.getConsecutiveAuthRejections() >= maxAuthRejections) {
                    return Transition.to(DISCONNECTED, Effect.RETIRE);
                }
                return Transition.to(DISCONNECTED, Effect.SCHEDULE_RECONNECT);
            case DISCONNECT_REQUESTED:
                return Transition.to(CLOSING_INTENTIONAL, Effect.CANCEL_RECONNECT, Effect.CLOSE_TRANSPORT);
            case TRANSPORT_ERROR:
            default:
                // errors never reconnect on their own; the close that follows does
                return Transition.to(current);
        }
    }
}
