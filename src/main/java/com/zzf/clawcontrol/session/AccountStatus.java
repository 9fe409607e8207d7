package com.zzf.clawcontrol.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.zzf.clawcontrol.connection.ConnectionState;
import lombok.Builder;
import lombok.Data;

@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class AccountStatus {
    private String accountId;
    private String name;
    private boolean enabled;
    private boolean configured;
    private boolean running;
    private boolean connected;
    private boolean retired;
    private ConnectionState state;
    private String endpoint;
    private String notesPath;
    private Integer threadCount;
    private Long lastStartAt;
    private Long lastStopAt;
    private String lastError;
}
