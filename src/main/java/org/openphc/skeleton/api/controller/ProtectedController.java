package org.openphc.skeleton.api.controller;

import org.openphc.skeleton.security.AuthenticatedUser;
import org.openphc.skeleton.security.AuthenticationInterceptor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestAttribute;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Requires a valid bearer token; see {@link AuthenticationInterceptor}.
 */
@RestController
public class ProtectedController {

    @GetMapping("/api/protected")
    public ResponseEntity<Map<String, Object>> protectedResource(
            @RequestAttribute(AuthenticationInterceptor.AUTHENTICATED_USER_ATTRIBUTE) AuthenticatedUser user) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("message", "Access granted");
        body.put("user", user);
        return ResponseEntity.ok(body);
    }
}
