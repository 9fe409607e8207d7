package com.zzf.clawcontrol.protocol;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class ThreadListFrame implements InboundFrame {
    private String type = FrameTypes.THREAD_LIST;
    private List<ThreadInfo> threads = new ArrayList<>();
}
