package com.flagship.pawnshop.access;

import com.flagship.pawnshop.config.PawnshopProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.SignatureAlgorithm;
import io.jsonwebtoken.security.Keys;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.security.Key;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Optional;
import java.util.UUID;

/**
 * Issues and verifies HS256 access tokens.
 *
 * The subject is the user id. Role and permissions are not trusted from the token:
 * they are re-read from the database on every request.
 */
@Service
@Slf4j
public class TokenService {

    private static final int MIN_SECRET_BYTES = 32;

    private final Key key;
    private final String issuer;
    private final Duration ttl;
    private final Clock clock;

    public TokenService(PawnshopProperties properties, Clock clock) {
        PawnshopProperties.Security security = properties.getSecurity();
        String secret = security.getJwtSecret();
        if (secret == null || secret.getBytes(StandardCharsets.UTF_8).length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                "pawnshop.security.jwt-secret must be set and at least " + MIN_SECRET_BYTES + " bytes long");
        }
        this.key = Keys.hmacShaKeyFor(secret.getBytes(StandardCharsets.UTF_8));
        this.issuer = security.getIssuer();
        this.ttl = security.getTokenTtl();
        this.clock = clock;
    }

    public String issue(UserEntity user) {
        Instant now = clock.instant();
        return Jwts.builder()
            .setSubject(user.getId().toString())
            .claim("username", user.getUsername())
            .setIssuer(issuer)
            .setIssuedAt(Date.from(now))
            .setExpiration(Date.from(now.plus(ttl)))
            .signWith(key, SignatureAlgorithm.HS256)
            .compact();
    }

    /**
     * Verifies signature, issuer and expiry and returns the user id.
     * Empty when the token is malformed, expired or signed with another key.
     */
    public Optional<UUID> verify(String token) {
        try {
            Claims claims = Jwts.parserBuilder()
                .setSigningKey(key)
                .requireIssuer(issuer)
                .setClock(() -> Date.from(clock.instant()))
                .build()
                .parseClaimsJws(token)
                .getBody();
            return Optional.of(UUID.fromString(claims.getSubject()));
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected access token: {}", e.getMessage());
            return Optional.empty();
        }
    }

    public Duration getTtl() {
        return ttl;
    }
}
