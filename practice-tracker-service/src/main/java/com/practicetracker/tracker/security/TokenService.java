package com.practicetracker.tracker.security;

import com.practicetracker.tracker.exception.ApiException;
import io.jsonwebtoken.ClaimJwtException;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.JwtParser;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import io.jsonwebtoken.security.WeakKeyException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Date;

/**
 * Issues and validates HS256 bearer tokens carrying the user id as subject.
 * <p>
 * Tokens never expire: none is issued with an {@code exp} claim, and unless
 * {@code jwt.enforce-expiry} is set, validation ignores {@code exp} and
 * {@code nbf} on tokens that carry them. Only the signature and the subject
 * are checked.
 */
@Component
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    private static final String BEARER_PREFIX = "Bearer ";

    /**
     * Used when {@code jwt.secret} is empty. Anyone who knows this value can
     * mint tokens for any user.
     */
    static final String INSECURE_DEFAULT_SECRET = "ThisISMYSectKeyXHaxx1234-insecure-default";

    private final SecretKey secretKey;
    private final JwtParser parser;
    private final boolean enforceExpiry;
    private final Clock clock;

    public TokenService(@Value("${jwt.secret:}") String secret,
                        @Value("${jwt.enforce-expiry:false}") boolean enforceExpiry,
                        Clock clock) {
        String effective = secret;
        if (effective == null || effective.isBlank()) {
            log.warn("jwt.secret is not set; signing tokens with the built-in INSECURE default key. "
                    + "Set JWT_SECRET before exposing this service.");
            effective = INSECURE_DEFAULT_SECRET;
        }
        try {
            this.secretKey = Keys.hmacShaKeyFor(effective.getBytes(StandardCharsets.UTF_8));
        } catch (WeakKeyException e) {
            throw new IllegalStateException("jwt.secret must be at least 32 bytes long", e);
        }
        this.parser = Jwts.parser()
                .verifyWith(secretKey)
                .build();
        this.enforceExpiry = enforceExpiry;
        this.clock = clock;
    }

    /**
     * Create a token for the given user
     */
    public String issue(Long userId) {
        return Jwts.builder()
                .subject(String.valueOf(userId))
                .issuedAt(Date.from(clock.instant()))
                .signWith(secretKey)
                .compact();
    }

    /**
     * Extract the user id from a token, failing with UNAUTHORIZED when the
     * token is malformed, badly signed or has no numeric subject.
     */
    public Long validate(String token) {
        Claims claims;
        try {
            claims = parser.parseSignedClaims(token).getPayload();
        } catch (ClaimJwtException e) {
            // Signature already verified at this point; only exp/nbf failed.
            if (enforceExpiry) {
                throw ApiException.unauthorized("Token expired");
            }
            claims = e.getClaims();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getMessage());
            throw ApiException.unauthorized("Invalid token");
        }

        String subject = claims.getSubject();
        if (subject == null || subject.isBlank()) {
            throw ApiException.unauthorized("Invalid token");
        }
        try {
            return Long.parseLong(subject);
        } catch (NumberFormatException e) {
            throw ApiException.unauthorized("Invalid token");
        }
    }

    /**
     * Resolve the user id from an {@code Authorization} header value
     */
    public Long resolveBearer(String authHeader) {
        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)) {
            throw ApiException.unauthorized("Missing authorization header");
        }
        return validate(authHeader.substring(BEARER_PREFIX.length()).trim());
    }

    boolean isEnforcingExpiry() {
        return enforceExpiry;
    }
}
