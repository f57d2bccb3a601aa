package org.openphc.skeleton.api.controller;

import lombok.RequiredArgsConstructor;
import org.openphc.skeleton.api.dto.StatusDto;
import org.openphc.skeleton.service.SystemInfoService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Liveness endpoints.
 */
@RestController
@RequiredArgsConstructor
public class HealthController {

    private final SystemInfoService systemInfoService;

    @GetMapping("/health")
    public ResponseEntity<StatusDto> health() {
        return ResponseEntity.ok(StatusDto.builder()
                .status("OK")
                .timestamp(Instant.now().toString())
                .uptime(systemInfoService.uptimeSeconds())
                .build());
    }

    @GetMapping("/api")
    public ResponseEntity<StatusDto> apiStatus() {
        return ResponseEntity.ok(StatusDto.builder()
                .status("OK")
                .message("Service is running")
                .build());
    }
}
