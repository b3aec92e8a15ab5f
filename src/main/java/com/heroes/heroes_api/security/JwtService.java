package com.heroes.heroes_api.security;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.Date;
import java.util.function.Function;

import javax.crypto.SecretKey;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.security.core.userdetails.UserDetails;
import org.springframework.stereotype.Service;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;

/**
 * Issues and reads the bearer tokens handed out by {@code POST /token}. Tokens
 * are HS256-signed, carry the username as subject and expire after
 * {@code jwt.expiration-ms}.
 */
@Service
public class JwtService {

    private static final Logger logger = LoggerFactory.getLogger(JwtService.class);

    private final String secretKeyString;
    private final long expirationMs;

    public JwtService(@Value("${jwt.secret}") String secretKeyString,
                      @Value("${jwt.expiration-ms:1800000}") long expirationMs) {
        this.secretKeyString = secretKeyString;
        this.expirationMs = expirationMs;
    }

    public String generateToken(UserDetails userDetails) {
        Date now = new Date();
        return Jwts.builder()
                .subject(userDetails.getUsername())
                .issuedAt(now)
                .expiration(new Date(now.getTime() + expirationMs))
                .signWith(getSigningKey())
                .compact();
    }

    /**
     * Returns the username carried by a valid token.
     *
     * @throws JwtException if the token is malformed, expired or not signed with our key
     */
    public String extractUsername(String token) {
        return extractClaim(token, Claims::getSubject);
    }

    private <T> T extractClaim(String token, Function<Claims, T> claimsResolver) {
        return claimsResolver.apply(extractAllClaims(token));
    }

    private Claims extractAllClaims(String token) {
        // Expiry is checked by the parser itself
        return Jwts.parser()
                .verifyWith(getSigningKey())
                .build()
                .parseSignedClaims(token)
                .getPayload();
    }

    /**
     * Any configured string is accepted and stretched to a 32-byte HMAC key with SHA-256.
     */
    private SecretKey getSigningKey() {
        if (secretKeyString == null || secretKeyString.isEmpty()) {
            logger.error("FATAL: JWT Secret Key (jwt.secret) is not configured!");
            throw new IllegalStateException("JWT Secret Key is missing. Please set JWT_SECRET environment variable.");
        }
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return Keys.hmacShaKeyFor(digest.digest(secretKeyString.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            logger.error("FATAL: SHA-256 algorithm not available: {}", e.getMessage());
            throw new IllegalStateException("SHA-256 algorithm not available", e);
        }
    }
}
