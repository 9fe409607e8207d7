package com.zzf.clawcontrol.controller;

import com.zzf.clawcontrol.config.BridgeAccount;
import com.zzf.clawcontrol.config.BridgeProperties;
import com.zzf.clawcontrol.connection.ConnectionState;
import com.zzf.clawcontrol.session.AccountStatus;
import com.zzf.clawcontrol.session.BridgeSessionManager;
import com.zzf.clawcontrol.session.HealthProbe;
import com.zzf.clawcontrol.session.ProbeResult;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class BridgeStatusControllerTest {

    private final BridgeSessionManager manager = mock(BridgeSessionManager.class);
    private final HealthProbe probe = mock(HealthProbe.class);
    private final BridgeProperties properties = new BridgeProperties();
    private final BridgeStatusController controller = new BridgeStatusController(manager, properties, probe);

    @Test
    void statusCountsConnectedAccounts() {
        when(manager.listStatuses()).thenReturn(List.of(
                AccountStatus.builder().accountId("default").running(true).connected(true).state(ConnectionState.CONNECTED).build(),
                AccountStatus.builder().accountId("work").running(true).connected(false).state(ConnectionState.DISCONNECTED).build()));

        Map<String, Object> response = controller.status();

        assertEquals(1L, response.get("connected"));
        assertEquals(2, ((List<?>) response.get("accounts")).size());
    }

    @Test
    void probeUsesResolvedAccount() {
        properties.setUrl("http://localhost:3100");
        properties.setToken("t");
        when(probe.probe(any(BridgeAccount.class))).thenReturn(new ProbeResult(true, 200, null, 3L));

        ResponseEntity<ProbeResult> response = controller.probe("default");

        assertEquals(HttpStatus.OK, response.getStatusCode());
        assertTrue(response.getBody().isOk());
    }

    @Test
    void probeOfUnknownAccountIsNotFound() {
        ResponseEntity<ProbeResult> response = controller.probe("ghost");

        assertEquals(HttpStatus.NOT_FOUND, response.getStatusCode());
        assertFalse(response.getBody().isOk());
        verify(probe, never()).probe(any());
    }
}
