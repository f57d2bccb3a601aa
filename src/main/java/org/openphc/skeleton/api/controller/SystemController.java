package org.openphc.skeleton.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.ApiResponse;
import org.openphc.skeleton.api.dto.ErrorEnvelope;
import org.openphc.skeleton.api.dto.SystemInfoDto;
import org.openphc.skeleton.api.dto.WelcomeDto;
import org.openphc.skeleton.config.AppConfiguration;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.service.ErrorResponder;
import org.openphc.skeleton.service.SystemInfoService;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;

/**
 * Informational endpoints plus a route that always fails, for exercising the error pipeline.
 */
@RestController
@RequestMapping("/api")
@RequiredArgsConstructor
@Slf4j
public class SystemController {

    static final String SIMULATED_ERROR_MESSAGE = "Simulated server error for testing purposes";

    private final AppConfiguration configuration;
    private final SystemInfoService systemInfoService;
    private final ErrorResponder errorResponder;

    @GetMapping("/welcome")
    public ResponseEntity<ApiResponse<WelcomeDto>> welcome() {
        log.info("Welcome message sent");
        return ResponseEntity.ok(ApiResponse.success(WelcomeDto.builder()
                .message("Welcome to the API")
                .environment(configuration.getEnvironment())
                .timestamp(Instant.now().toString())
                .documentation("/docs")
                .build()));
    }

    @GetMapping("/system")
    public ResponseEntity<ApiResponse<SystemInfoDto>> systemInfo() {
        log.info("System info retrieved");
        return ResponseEntity.ok(ApiResponse.success(systemInfoService.describe()));
    }

    @GetMapping("/simulate-error")
    public ResponseEntity<ErrorEnvelope> simulateError(HttpServletRequest request) {
        return errorResponder.respond(Failure.of(500, SIMULATED_ERROR_MESSAGE), request);
    }
}
