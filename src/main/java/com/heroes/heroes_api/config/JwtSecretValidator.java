package com.heroes.heroes_api.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.CommandLineRunner;
import org.springframework.stereotype.Component;

/**
 * Validates JWT secret configuration on application startup. A missing secret
 * or the shipped placeholder stops the application; a short one only warns.
 */
@Component
public class JwtSecretValidator implements CommandLineRunner {

    private static final Logger logger = LoggerFactory.getLogger(JwtSecretValidator.class);

    static final String DEFAULT_SECRET = "change-me";
    static final int RECOMMENDED_LENGTH = 32;

    @Value("${jwt.secret:}")
    private String jwtSecret;

    @Override
    public void run(String... args) {
        logger.info("=== JWT SECRET VALIDATION ===");
        String verdict = check(jwtSecret);
        logger.info("=== JWT SECRET VALIDATION: {} ===", verdict);
        if ("FAILED".equals(verdict) || "INSECURE".equals(verdict)) {
            throw new IllegalStateException("Refusing to start with an unusable JWT secret (" + verdict
                    + "). Set the JWT_SECRET environment variable.");
        }
    }

    /**
     * Logs any problem with the configured secret and returns the overall verdict.
     */
    String check(String secret) {
        if (secret == null || secret.isBlank()) {
            logger.error("JWT Secret is not configured! Set the JWT_SECRET environment variable.");
            return "FAILED";
        }
        if (DEFAULT_SECRET.equals(secret)) {
            logger.error("JWT Secret still has the placeholder value. Tokens can be forged by anyone who reads the defaults.");
            return "INSECURE";
        }

        String masked = secret.length() > 10
            ? secret.substring(0, 3) + "..." + secret.substring(secret.length() - 3)
            : "****";
        logger.info("JWT Secret length: {}, masked: {}", secret.length(), masked);

        if (secret.length() < RECOMMENDED_LENGTH) {
            logger.warn("JWT Secret is short ({} characters). Use at least {} characters, e.g. openssl rand -base64 32.",
                    secret.length(), RECOMMENDED_LENGTH);
            return "WEAK";
        }
        return "OK";
    }
}
