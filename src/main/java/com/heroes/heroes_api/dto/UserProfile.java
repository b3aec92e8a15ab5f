package com.heroes.heroes_api.dto;

import com.heroes.heroes_api.model.AppUser;

/**
 * Public view of an authenticated user.
 */
public record UserProfile(String username, String email, String fullname, boolean disabled) {

    public static UserProfile from(AppUser user) {
        return new UserProfile(user.getUsername(), user.getEmail(), user.getFullname(), user.isDisabled());
    }
}
