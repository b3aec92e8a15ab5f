package com.heroes.heroes_api.controller;

import java.util.Map;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * Root endpoint to provide API information
 */
@RestController
public class RootController {

    @GetMapping("/")
    public ResponseEntity<Map<String, Object>> root() {
        return ResponseEntity.ok(Map.of(
            "service", "heroes-api",
            "status", "running",
            "endpoints", Map.of(
                "health", "/health",
                "teams", "/teams",
                "heroes", "/heroes",
                "auth", "/token, /users/me"
            )
        ));
    }
}
