package org.openphc.skeleton.api.controller;

import jakarta.validation.Valid;
import org.openphc.skeleton.api.dto.ApiResponse;
import org.openphc.skeleton.api.dto.EntityIdRequest;
import org.openphc.skeleton.api.exception.GlobalExceptionHandler;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Checks that a body carries a well-formed entity id (UUID). Constraint violations are reported
 * by {@link GlobalExceptionHandler#handleBeanValidation}.
 */
@RestController
@RequestMapping("/api/entities")
public class EntityController {

    @PostMapping("/validate")
    public ResponseEntity<ApiResponse<Map<String, String>>> validateId(@Valid @RequestBody EntityIdRequest request) {
        return ResponseEntity.ok(ApiResponse.success(Map.of("id", request.getId())));
    }
}
