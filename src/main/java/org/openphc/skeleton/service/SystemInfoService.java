package org.openphc.skeleton.service;

import lombok.RequiredArgsConstructor;
import org.openphc.skeleton.api.dto.SystemInfoDto;
import org.openphc.skeleton.config.AppConfiguration;
import org.springframework.stereotype.Service;

import java.lang.management.ManagementFactory;
import java.lang.management.MemoryUsage;
import java.time.Instant;

/**
 * Runtime facts about the running process.
 */
@Service
@RequiredArgsConstructor
public class SystemInfoService {

    private final AppConfiguration configuration;

    /**
     * Seconds since JVM start.
     */
    public double uptimeSeconds() {
        return ManagementFactory.getRuntimeMXBean().getUptime() / 1000.0;
    }

    public SystemInfoDto describe() {
        MemoryUsage heap = ManagementFactory.getMemoryMXBean().getHeapMemoryUsage();
        return SystemInfoDto.builder()
                .environment(configuration.getEnvironment())
                .javaVersion(System.getProperty("java.version"))
                .uptime(uptimeSeconds())
                .memory(SystemInfoDto.Memory.builder()
                        .heapMax(heap.getMax())
                        .heapTotal(heap.getCommitted())
                        .heapUsed(heap.getUsed())
                        .build())
                .timestamp(Instant.now().toString())
                .build();
    }
}
