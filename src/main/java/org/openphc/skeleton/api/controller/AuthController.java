package org.openphc.skeleton.api.controller;

import jakarta.servlet.http.HttpServletRequest;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.api.dto.ApiResponse;
import org.openphc.skeleton.api.dto.TokenDto;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.security.TokenService;
import org.openphc.skeleton.service.ErrorResponder;
import org.openphc.skeleton.validation.RequestValidator;
import org.openphc.skeleton.validation.ValidationResult;
import org.openphc.skeleton.validation.ValidationRuleSets;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Locale;
import java.util.Map;

/**
 * Demo login: validates the body and issues a bearer token for the given email.
 * There is no credential store behind it, so the password is not checked.
 */
@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
@Slf4j
public class AuthController {

    static final String DEFAULT_ROLE = "user";

    private final RequestValidator requestValidator;
    private final ValidationRuleSets ruleSets;
    private final TokenService tokenService;
    private final ErrorResponder errorResponder;

    @PostMapping("/login")
    public ResponseEntity<?> login(@RequestBody Map<String, Object> body, HttpServletRequest request) {
        ValidationResult validation = requestValidator.validate(ruleSets.login(), body);
        if (!validation.isValid()) {
            return errorResponder.respond(Failure.validation(validation.violations()), request);
        }

        String email = String.valueOf(body.get("email")).trim().toLowerCase(Locale.ROOT);
        String token = tokenService.issueToken(email, DEFAULT_ROLE);
        log.info("Issued token for {}", email);
        return ResponseEntity.ok(ApiResponse.success(TokenDto.builder()
                .token(token)
                .tokenType("Bearer")
                .expiresIn(tokenService.getExpirationSeconds())
                .build()));
    }
}
