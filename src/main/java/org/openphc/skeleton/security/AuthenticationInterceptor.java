package org.openphc.skeleton.security;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;
import org.openphc.skeleton.domain.model.Failure;
import org.openphc.skeleton.service.ErrorResponder;
import org.springframework.http.HttpHeaders;
import org.springframework.stereotype.Component;
import org.springframework.web.cors.CorsUtils;
import org.springframework.web.servlet.HandlerInterceptor;

import java.io.IOException;
import java.util.Locale;
import java.util.Optional;

/**
 * Guards protected routes with a bearer token; CORS preflight requests pass through. Rejections are written by the {@link ErrorResponder};
 * on success the {@link AuthenticatedUser} is exposed as a request attribute.
 */
@Component
@RequiredArgsConstructor
public class AuthenticationInterceptor implements HandlerInterceptor {

    public static final String AUTHENTICATED_USER_ATTRIBUTE = "authenticatedUser";

    static final String MISSING_TOKEN_MESSAGE = "Access token required";
    private static final String BEARER_PREFIX = "bearer";

    private final TokenService tokenService;
    private final ErrorResponder errorResponder;

    @Override
    public boolean preHandle(HttpServletRequest request, HttpServletResponse response, Object handler)
            throws IOException {
        // preflight carries no credentials; CORS processing answers it
        if (CorsUtils.isPreFlightRequest(request)) {
            return true;
        }

        Optional<String> token = extractBearerToken(request.getHeader(HttpHeaders.AUTHORIZATION));
        if (token.isEmpty()) {
            errorResponder.write(Failure.of(HttpServletResponse.SC_UNAUTHORIZED, MISSING_TOKEN_MESSAGE),
                    request, response);
            return false;
        }

        TokenVerification verification = tokenService.verify(token.get());
        if (!verification.isValid()) {
            errorResponder.write(verification.failure(), request, response);
            return false;
        }

        request.setAttribute(AUTHENTICATED_USER_ATTRIBUTE, verification.user());
        return true;
    }

    static Optional<String> extractBearerToken(String authorizationHeader) {
        if (authorizationHeader == null || authorizationHeader.isBlank()) {
            return Optional.empty();
        }
        String trimmed = authorizationHeader.strip();
        if (!trimmed.toLowerCase(Locale.ROOT).startsWith(BEARER_PREFIX)) {
            return Optional.empty();
        }
        String remainder = trimmed.substring(BEARER_PREFIX.length());
        if (!remainder.isEmpty() && !Character.isWhitespace(remainder.charAt(0))) {
            return Optional.empty();
        }
        String token = remainder.strip();
        return token.isEmpty() ? Optional.empty() : Optional.of(token);
    }
}
