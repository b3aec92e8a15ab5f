package com.heroes.heroes_api.security;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import com.heroes.heroes_api.model.AppUser;

import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;

class JwtServiceTest {

    private final JwtService jwtService = new JwtService("unit-test-secret", 60_000);

    private final AppUser alice = new AppUser("alice", "alice20@gmail.com", "Alice Wonderson", "x", false);

    @Test
    void tokenCarriesUsernameAsSubject() {
        String token = jwtService.generateToken(alice);

        assertThat(token).isNotEqualTo("alice");
        assertThat(jwtService.extractUsername(token)).isEqualTo("alice");
    }

    @Test
    void tokenSignedWithAnotherSecretIsRejected() {
        String foreign = new JwtService("some-other-secret", 60_000).generateToken(alice);

        assertThatThrownBy(() -> jwtService.extractUsername(foreign)).isInstanceOf(JwtException.class);
    }

    @Test
    void expiredTokenIsRejected() {
        String expired = new JwtService("unit-test-secret", -1_000).generateToken(alice);

        assertThatThrownBy(() -> jwtService.extractUsername(expired)).isInstanceOf(ExpiredJwtException.class);
    }

    @Test
    void tamperedTokenIsRejected() {
        String token = jwtService.generateToken(alice);
        String tampered = token.substring(0, token.length() - 2) + (token.endsWith("AA") ? "BB" : "AA");

        assertThatThrownBy(() -> jwtService.extractUsername(tampered)).isInstanceOf(JwtException.class);
    }

    @Test
    void missingSecretFailsFast() {
        JwtService unconfigured = new JwtService("", 60_000);

        assertThatThrownBy(() -> unconfigured.generateToken(alice)).isInstanceOf(IllegalStateException.class);
    }
}
