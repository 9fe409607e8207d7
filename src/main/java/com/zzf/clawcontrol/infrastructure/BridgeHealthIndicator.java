package com.zzf.clawcontrol.infrastructure;

import com.zzf.clawcontrol.session.AccountStatus;
import com.zzf.clawcontrol.session.BridgeSessionManager;
import lombok.RequiredArgsConstructor;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Reports {@code clawcontrol} under {@code /actuator/health}. Down when a running session
 * has been retired, since it will never reconnect on its own.
 */
@Component("clawcontrol")
@RequiredArgsConstructor
public class BridgeHealthIndicator implements HealthIndicator {

    private final BridgeSessionManager sessionManager;

    @Override
    public Health health() {
        Health.Builder builder = Health.up();
        for (AccountStatus status : sessionManager.listStatuses()) {
            if (!status.isRunning()) {
                continue;
            }
            builder.withDetail(status.getAccountId(), status.getState() == null ? "UNKNOWN" : status.getState().name());
            if (status.isRetired()) {
                builder.down();
            }
        }
        return builder.build();
    }
}
