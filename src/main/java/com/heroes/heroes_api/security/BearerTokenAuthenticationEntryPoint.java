package com.heroes.heroes_api.security;

import java.io.IOException;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.security.core.AuthenticationException;
import org.springframework.security.web.AuthenticationEntryPoint;
import org.springframework.stereotype.Component;

import com.fasterxml.jackson.databind.ObjectMapper;

import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import lombok.RequiredArgsConstructor;

/**
 * Answers requests to protected endpoints that carry no usable bearer token.
 * A missing token is a 401; a token that was presented but rejected by
 * {@link JwtAuthenticationFilter} is a 400.
 */
@Component
@RequiredArgsConstructor
public class BearerTokenAuthenticationEntryPoint implements AuthenticationEntryPoint {

    private static final Logger logger = LoggerFactory.getLogger(BearerTokenAuthenticationEntryPoint.class);

    static final String NOT_AUTHENTICATED = "Not authenticated";
    static final String INVALID_CREDENTIALS = "Invalid Authentication Credentials";

    private final ObjectMapper objectMapper;

    @Override
    public void commence(HttpServletRequest request, HttpServletResponse response,
                         AuthenticationException authException) throws IOException {
        boolean rejected = request.getAttribute(JwtAuthenticationFilter.REJECTED_TOKEN_ATTRIBUTE) != null;
        HttpStatus status = rejected ? HttpStatus.BAD_REQUEST : HttpStatus.UNAUTHORIZED;
        String message = rejected ? INVALID_CREDENTIALS : NOT_AUTHENTICATED;
        logger.warn("Unauthenticated request to {}: {}", request.getRequestURI(), message);

        response.setStatus(status.value());
        response.setHeader(HttpHeaders.WWW_AUTHENTICATE, "Bearer");
        response.setContentType(MediaType.APPLICATION_JSON_VALUE);
        objectMapper.writeValue(response.getOutputStream(), Map.of("message", message));
    }
}
