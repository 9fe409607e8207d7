package com.zzf.clawcontrol.connection;

import lombok.Builder;
import lombok.Getter;
import lombok.ToString;

@Getter
@Builder
@ToString(exclude = "token")
public class ConnectionSettings {
    private final String accountId;
    private final String url;
    private final String token;
    @Builder.Default
    private final long reconnectDelayMillis = 3_000L;
    @Builder.Default
    private final long requestTimeoutMillis = 10_000L;
    @Builder.Default
    private final int maxAuthRejections = 5;
}
