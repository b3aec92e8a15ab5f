package com.heroes.heroes_api.config;

import java.util.ArrayList;
import java.util.List;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Static user table, bound from {@code auth.users[n].*}.
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "auth")
public class AuthProperties {

    private List<User> users = new ArrayList<>();

    @Getter
    @Setter
    public static class User {
        private String username;
        private String email;
        private String fullname;
        private String password;
        private boolean disabled;
    }
}
