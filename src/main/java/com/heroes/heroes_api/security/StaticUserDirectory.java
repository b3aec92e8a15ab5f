package com.heroes.heroes_api.security;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.core.userdetails.UserDetailsService;
import org.springframework.security.core.userdetails.UsernameNotFoundException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import com.heroes.heroes_api.config.AuthProperties;
import com.heroes.heroes_api.model.AppUser;

/**
 * The fixed user table behind the token endpoint. Built once from
 * {@link AuthProperties}; configured passwords are encoded on load and the
 * plain values are not kept.
 */
@Component
public class StaticUserDirectory implements UserDetailsService {

    private static final Logger logger = LoggerFactory.getLogger(StaticUserDirectory.class);

    private final Map<String, AppUser> users;

    public StaticUserDirectory(AuthProperties properties, PasswordEncoder passwordEncoder) {
        Map<String, AppUser> loaded = new LinkedHashMap<>();
        for (AuthProperties.User user : properties.getUsers()) {
            if (user.getUsername() == null || user.getPassword() == null) {
                throw new IllegalArgumentException("Every auth.users entry needs a username and a password.");
            }
            loaded.put(user.getUsername(), new AppUser(
                    user.getUsername(),
                    user.getEmail(),
                    user.getFullname(),
                    passwordEncoder.encode(user.getPassword()),
                    user.isDisabled()));
        }
        this.users = Collections.unmodifiableMap(loaded);
        logger.info("Loaded {} user(s) into the static user directory", users.size());
    }

    public Optional<AppUser> findByUsername(String username) {
        return Optional.ofNullable(users.get(username));
    }

    @Override
    public AppUser loadUserByUsername(String username) {
        return findByUsername(username)
                .orElseThrow(() -> new UsernameNotFoundException("User not found with username: " + username));
    }
}
