package com.zzf.clawcontrol.session;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ProbeResult {
    private boolean ok;
    private Integer status;
    private String error;
    private long elapsedMs;

    public static ProbeResult failed(String error, long elapsedMs) {
        return new ProbeResult(false, null, error, elapsedMs);
    }
}
