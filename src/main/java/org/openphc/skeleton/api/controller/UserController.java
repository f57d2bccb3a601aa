package org.openphc.skeleton.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.UserDto;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.service.ErrorResponder;
import org.openphc.skeleton.service.UserService;
import org.openphc.skeleton.validation.RequestValidator;
import org.openphc.skeleton.validation.ValidationResult;
import org.openphc.skeleton.validation.ValidationRuleSets;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;
import java.util.UUID;

/**
 * User endpoints. Users are validated and echoed back; nothing is stored.
 */
@RestController
@RequestMapping("/api/users")
@RequiredArgsConstructor
@Slf4j
public class UserController {

    private final RequestValidator requestValidator;
    private final ValidationRuleSets ruleSets;
    private final UserService userService;
    private final ErrorResponder errorResponder;

    @PostMapping
    public ResponseEntity<?> createUser(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        ValidationResult validation = requestValidator.validate(ruleSets.user(), body);
        if (!validation.isValid()) {
            return errorResponder.respond(Failure.validation(validation.violations()), request);
        }

        UserDto user = userService.create(body);
        log.info("Created user: id={}", user.getId());
        return ResponseEntity.status(HttpStatus.CREATED).body(user);
    }

    /**
     * A non-UUID id never reaches this method; it is rejected as a type mismatch.
     */
    @GetMapping("/{id}")
    public ResponseEntity<?> getUser(@PathVariable UUID id, HttpServletRequest request) {
        // users are not persisted
        return errorResponder.respond(Failure.of(404, "User not found"), request);
    }
}
