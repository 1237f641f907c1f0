package com.flagship.pawnshop.access;

import com.flagship.pawnshop.config.PawnshopProperties;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.*;

class TokenServiceTest {

    private static final Instant ISSUED_AT = Instant.parse("2024-06-15T10:00:00Z");
    private static final String SECRET = "token-service-test-secret-token-service-test";

    private static TokenService tokenService(String secret, Instant now) {
        PawnshopProperties properties = new PawnshopProperties();
        properties.getSecurity().setJwtSecret(secret);
        return new TokenService(properties, Clock.fixed(now, ZoneOffset.UTC));
    }

    private static UserEntity user() {
        return UserEntity.create("clerk", "clerk@pawnshop.local", "hash", "Clerk", "One", false, UUID.randomUUID());
    }

    @Test
    void issuedTokenResolvesToUser() {
        TokenService service = tokenService(SECRET, ISSUED_AT);
        UserEntity user = user();

        assertEquals(Optional.of(user.getId()), service.verify(service.issue(user)));
        assertEquals(Duration.ofHours(8), service.getTtl());
    }

    @Test
    void expiredTokenIsRejected() {
        String token = tokenService(SECRET, ISSUED_AT).issue(user());

        assertTrue(tokenService(SECRET, ISSUED_AT.plus(Duration.ofHours(9))).verify(token).isEmpty());
    }

    @Test
    void tokenSignedWithAnotherKeyIsRejected() {
        String token = tokenService("another-secret-another-secret-another-secret", ISSUED_AT).issue(user());

        assertTrue(tokenService(SECRET, ISSUED_AT).verify(token).isEmpty());
    }

    @Test
    void garbageIsRejected() {
        assertTrue(tokenService(SECRET, ISSUED_AT).verify("not-a-token").isEmpty());
    }

    @Test
    void shortSecretIsRefused() {
        assertThrows(IllegalStateException.class, () -> tokenService("too-short", ISSUED_AT));
    }
}
