package com.heroes.heroes_api.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.authentication.BadCredentialsException;
import org.springframework.security.authentication.DisabledException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import com.heroes.heroes_api.dto.TokenResponse;
import com.heroes.heroes_api.dto.UserProfile;
import com.heroes.heroes_api.model.AppUser;
import com.heroes.heroes_api.security.JwtService;
import com.heroes.heroes_api.security.StaticUserDirectory;

import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class AuthService {

    private static final Logger logger = LoggerFactory.getLogger(AuthService.class);

    static final String INCORRECT_CREDENTIALS = "incorrect username or password";
    static final String INACTIVE_USER = "Inactive User";

    private final StaticUserDirectory userDirectory;
    private final PasswordEncoder passwordEncoder;
    private final JwtService jwtService;

    /**
     * Checks the credentials against the user table and issues a bearer token.
     * Disabled users still get a token; they are turned away when they use it.
     */
    public TokenResponse login(String username, String password) {
        logger.info("Token requested for user: {}", username);
        AppUser user = userDirectory.findByUsername(username)
                .orElseThrow(() -> {
                    logger.warn("Token request for unknown user: {}", username);
                    return new BadCredentialsException(INCORRECT_CREDENTIALS);
                });

        if (password == null || !passwordEncoder.matches(password, user.getPassword())) {
            logger.warn("Invalid credentials for user: {}", username);
            throw new BadCredentialsException(INCORRECT_CREDENTIALS);
        }

        String token = jwtService.generateToken(user);
        logger.info("Token issued for user: {}", username);
        return TokenResponse.bearer(token);
    }

    public UserProfile currentActiveUser(AppUser user) {
        if (user.isDisabled()) {
            logger.warn("Inactive user '{}' attempted to access their profile", user.getUsername());
            throw new DisabledException(INACTIVE_USER);
        }
        return UserProfile.from(user);
    }
}
