package com.zzf.clawcontrol.connection;

import com.zzf.clawcontrol.transport.CloseCodes;
import org.junit.jupiter.api.Test;

import static com.zzf.clawcontrol.connection.ConnectionState.CLOSING_INTENTIONAL;
import static com.zzf.clawcontrol.connection.ConnectionState.CONNECTED;
import static com.zzf.clawcontrol.connection.ConnectionState.CONNECTING;
import static com.zzf.clawcontrol.connection.ConnectionState.DISCONNECTED;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class ConnectionStateMachineTest {

    private final ConnectionStateMachine machine = new ConnectionStateMachine(3);

    @Test
    public void testConnectFromIdleOpensTransport() {
        assertEquals(Transition.to(CONNECTING, Effect.CANCEL_RECONNECT, Effect.OPEN_TRANSPORT),
                machine.next(DISCONNECTED, ConnectionEvent.connectRequested()));
        assertEquals(Transition.to(CONNECTED), machine.next(CONNECTED, ConnectionEvent.connectRequested()));
        assertEquals(Transition.to(CONNECTING), machine.next(CONNECTING, ConnectionEvent.connectRequested()));
    }

    @Test
    public void testOpenSendsHandshake() {
        assertEquals(Transition.to(CONNECTED, Effect.SEND_HANDSHAKE), machine.next(CONNECTING, ConnectionEvent.opened()));
    }

    @Test
    public void testOpenAfterIntentionalCloseClosesAgain() {
        assertEquals(Transition.to(CLOSING_INTENTIONAL, Effect.CLOSE_TRANSPORT),
                machine.next(CLOSING_INTENTIONAL, ConnectionEvent.opened()));
    }

    @Test
    public void testCloseSchedulesReconnectUnlessSuperseded() {
        assertEquals(Transition.to(DISCONNECTED, Effect.SCHEDULE_RECONNECT),
                machine.next(CONNECTED, ConnectionEvent.closed(CloseCodes.ABNORMAL, "")));
        assertEquals(Transition.to(DISCONNECTED, Effect.SCHEDULE_RECONNECT),
                machine.next(CONNECTING, ConnectionEvent.closed(CloseCodes.NORMAL, "")));
        assertEquals(Transition.to(DISCONNECTED, Effect.RETIRE),
                machine.next(CONNECTED, ConnectionEvent.closed(CloseCodes.SUPERSEDED, "")));
    }

    @Test
    public void testCloseDuringIntentionalShutdownIsQuiet() {
        assertEquals(Transition.to(CLOSING_INTENTIONAL),
                machine.next(CLOSING_INTENTIONAL, ConnectionEvent.closed(CloseCodes.NORMAL, "")));
    }

    @Test
    public void testAuthRejectionRetiresAtLimit() {
        assertEquals(Transition.to(DISCONNECTED, Effect.SCHEDULE_RECONNECT),
                machine.next(CONNECTING, ConnectionEvent.authRejected(2, "HTTP 401")));
        assertEquals(Transition.to(DISCONNECTED, Effect.RETIRE),
                machine.next(CONNECTING, ConnectionEvent.authRejected(3, "HTTP 401")));
    }

    @Test
    public void testReconnectDueOnlyFromDisconnected() {
        assertEquals(Transition.to(CONNECTING, Effect.OPEN_TRANSPORT), machine.next(DISCONNECTED, ConnectionEvent.reconnectDue()));
        assertEquals(Transition.to(CLOSING_INTENTIONAL), machine.next(CLOSING_INTENTIONAL, ConnectionEvent.reconnectDue()));
    }

    @Test
    public void testDisconnectFromAnyState() {
        for (ConnectionState state : ConnectionState.values()) {
            assertEquals(Transition.to(CLOSING_INTENTIONAL, Effect.CANCEL_RECONNECT, Effect.CLOSE_TRANSPORT),
                    machine.next(state, ConnectionEvent.disconnectRequested()));
        }
    }

    @Test
    public void testErrorNeverMovesState() {
        for (ConnectionState state : ConnectionState.values()) {
            assertEquals(Transition.to(state), machine.next(state, ConnectionEvent.transportError("x")));
        }
    }

    @Test
    public void testMaxAuthRejectionsHasFloorOfOne() {
        assertEquals(1, new ConnectionStateMachine(0).getMaxAuthRejections());
    }
}
