package com.simboard.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.UUID;

import com.simboard.backend.modules.auth.infrastructure.jwt.SessionKeyProvider;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;
import org.springframework.stereotype.Service;

/**
 * Signs and verifies the browser session credential that the OAuth callback stores in a cookie.
 */
@Service
public class SessionTokenService {

    private static final String AUDIENCE = "simboard:session";

    private final SessionKeyProvider keyProvider;
    private final SessionProperties properties;
    private final Clock clock;

    public SessionTokenService(SessionKeyProvider keyProvider, SessionProperties properties, Clock clock) {
        this.keyProvider = keyProvider;
        this.properties = properties;
        this.clock = clock;
    }

    public String issue(UUID userId) {
        Instant now = clock.instant();
        return Jwts.builder()
                .subject(userId.toString())
                .audience().add(AUDIENCE).and()
                .issuedAt(Date.from(now))
                .expiration(Date.from(now.plus(properties.ttl())))
                .signWith(keyProvider.getSecretKey(), SIG.HS256)
                .compact();
    }

    public ParsedSession parse(String token) {
        try {
            Claims claims = Jwts.parser()
                    .verifyWith(keyProvider.getSecretKey())
                    .requireAudience(AUDIENCE)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();

            if (claims.getSubject() == null || claims.getExpiration() == null) {
                throw new InvalidSessionException("Session token lacks subject or expiry", null);
            }
            UUID userId = UUID.fromString(claims.getSubject());
            Instant expiresAt = claims.getExpiration().toInstant();
            return new ParsedSession(userId, OffsetDateTime.ofInstant(expiresAt, clock.getZone()));
        } catch (JwtException | IllegalArgumentException e) {
            throw new InvalidSessionException("Invalid session token", e);
        }
    }

    public record ParsedSession(UUID userId, OffsetDateTime expiresAt) {
    }

    public static class InvalidSessionException extends RuntimeException {
        public InvalidSessionException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
