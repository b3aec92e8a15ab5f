package com.heroes.heroes_api.exception;

/**
 * Thrown when a write would break a uniqueness rule, e.g. two heroes sharing
 * a password hash.
 */
public class ConflictException extends RuntimeException {

    public ConflictException(String message) {
        super(message);
    }
}
