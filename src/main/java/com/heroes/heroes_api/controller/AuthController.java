package com.heroes.heroes_api.controller;

import org.springframework.http.MediaType;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.heroes.heroes_api.dto.TokenResponse;
import com.heroes.heroes_api.dto.UserProfile;
import com.heroes.heroes_api.model.AppUser;
import com.heroes.heroes_api.service.AuthService;

import io.swagger.v3.oas.annotations.security.SecurityRequirement;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;

/**
 * Token issuance and the current-user endpoint. Credential and account
 * failures are raised by {@link AuthService} and mapped by the global handler.
 */
@RestController
@Tag(name = "auth", description = "Bearer token issuance and the current user")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping(value = "/token", consumes = MediaType.APPLICATION_FORM_URLENCODED_VALUE)
    public TokenResponse login(@RequestParam String username, @RequestParam String password) {
        return authService.login(username, password);
    }

    @SecurityRequirement(name = "bearer")
    @GetMapping("/users/me")
    public UserProfile me(@AuthenticationPrincipal AppUser user) {
        return authService.currentActiveUser(user);
    }
}
