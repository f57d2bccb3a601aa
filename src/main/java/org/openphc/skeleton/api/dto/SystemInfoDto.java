package org.openphc.skeleton.api.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemInfoDto {

    private String environment;
    private String javaVersion;
    private double uptime;
    private Memory memory;
    private String timestamp;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class Memory {
        private long heapMax;
        private long heapTotal;
        private long heapUsed;
    }
}
