package org.openphc.skeleton.security;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.openphc.skeleton.config.AppConfiguration;
import org.openphc.skeleton.domain.model.Failure;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.Date;

/**
 * Issues and verifies HS256 bearer tokens signed with the configured {@code jwtSecret}.
 */
@Service
@Slf4j
public class TokenService {

    static final String ISSUER = "rest-api-skeleton";
    static final String CLAIM_ROLE = "role";

    private static final int MIN_SECRET_BYTES = 32;

    private final SecretKey secretKey;
    private final long expirationSeconds;
    private final Clock clock;

    @Autowired
    public TokenService(AppConfiguration configuration) {
        this(configuration, Clock.systemUTC());
    }

    TokenService(AppConfiguration configuration, Clock clock) {
        AppConfiguration.SecuritySettings security = configuration.getSecurity();
        byte[] secret = security.jwtSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "jwtSecret must be at least " + MIN_SECRET_BYTES + " bytes for HS256");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret);
        this.expirationSeconds = security.jwtExpirationSeconds();
        this.clock = clock;
        log.info("TokenService initialized with expiration: {}s", expirationSeconds);
    }

    public String issueToken(String subject, String role) {
        Instant issuedAt = clock.instant();
        return Jwts.builder()
                .issuer(ISSUER)
                .subject(subject)
                .claim(CLAIM_ROLE, role)
                .issuedAt(Date.from(issuedAt))
                .expiration(Date.from(issuedAt.plusSeconds(expirationSeconds)))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verify signature, issuer and expiry. Expired tokens and every other rejection are reported
     * as distinct failure kinds.
     */
    public TokenVerification verify(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(ISSUER)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            return TokenVerification.valid(new AuthenticatedUser(
                    claims.getSubject(),
                    claims.get(CLAIM_ROLE, String.class),
                    claims.getIssuedAt() != null ? claims.getIssuedAt().toInstant() : null,
                    claims.getExpiration() != null ? claims.getExpiration().toInstant() : null));
        } catch (ExpiredJwtException e) {
            log.debug("Rejected expired token: {}", e.getMessage());
            return TokenVerification.failed(Failure.expiredCredential(e));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected malformed token: {}", e.getMessage());
            return TokenVerification.failed(Failure.malformedCredential(e));
        }
    }

    public long getExpirationSeconds() {
        return expirationSeconds;
    }
}
