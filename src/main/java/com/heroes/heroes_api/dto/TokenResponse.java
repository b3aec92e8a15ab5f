package com.heroes.heroes_api.dto;

/**
 * Body returned by the token endpoint.
 */
public record TokenResponse(String accessToken, String tokenType) {

    public static TokenResponse bearer(String accessToken) {
        return new TokenResponse(accessToken, "Bearer");
    }
}
