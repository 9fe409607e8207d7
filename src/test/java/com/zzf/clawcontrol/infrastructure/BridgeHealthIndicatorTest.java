package com.zzf.clawcontrol.infrastructure;

import com.zzf.clawcontrol.connection.ConnectionState;
import com.zzf.clawcontrol.session.AccountStatus;
import com.zzf.clawcontrol.session.BridgeSessionManager;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class BridgeHealthIndicatorTest {

    private final BridgeSessionManager manager = mock(BridgeSessionManager.class);
    private final BridgeHealthIndicator indicator = new BridgeHealthIndicator(manager);

    @Test
    void upWhileSessionsCanReconnect() {
        when(manager.listStatuses()).thenReturn(List.of(
                AccountStatus.builder().accountId("default").running(true).state(ConnectionState.DISCONNECTED).build(),
                AccountStatus.builder().accountId("idle").running(false).build()));

        Health health = indicator.health();

        assertEquals(Status.UP, health.getStatus());
        assertEquals("DISCONNECTED", health.getDetails().get("default"));
        assertEquals(1, health.getDetails().size());
    }

    @Test
    void downWhenASessionIsRetired() {
        when(manager.listStatuses()).thenReturn(List.of(
                AccountStatus.builder().accountId("default").running(true).retired(true).state(ConnectionState.DISCONNECTED).build()));

        assertEquals(Status.DOWN, indicator.health().getStatus());
    }
}
