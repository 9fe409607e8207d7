package com.zzf.clawcontrol.controller;

import com.zzf.clawcontrol.config.BridgeProperties;
import com.zzf.clawcontrol.session.AccountStatus;
import com.zzf.clawcontrol.session.BridgeSessionManager;
import com.zzf.clawcontrol.session.HealthProbe;
import com.zzf.clawcontrol.session.ProbeResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Slf4j
@RestController
@RequestMapping("/api/clawcontrol")
@RequiredArgsConstructor
public class BridgeStatusController {

    private final BridgeSessionManager sessionManager;
    private final BridgeProperties properties;
    private final HealthProbe healthProbe;

    @GetMapping("/status")
    public Map<String, Object> status() {
        List<AccountStatus> accounts = sessionManager.listStatuses();
        Map<String, Object> response = new HashMap<>();
        response.put("accounts", accounts);
        response.put("connected", accounts.stream().filter(AccountStatus::isConnected).count());
        return response;
    }

    @GetMapping("/accounts/{accountId}/probe")
    public ResponseEntity<ProbeResult> probe(@PathVariable String accountId) {
        if (!properties.listAccountIds().contains(accountId)) {
            return ResponseEntity.status(HttpStatus.NOT_FOUND)
                    .body(ProbeResult.failed("Unknown account: " + accountId, 0L));
        }
        ProbeResult result = healthProbe.probe(properties.resolveAccount(accountId));
        log.info("[{}] probe ok={} status={} elapsedMs={}", accountId, result.isOk(), result.getStatus(), result.getElapsedMs());
        return ResponseEntity.ok(result);
    }
}
