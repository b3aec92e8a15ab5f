package com.heroes.heroes_api.model;

import java.util.Collection;
import java.util.List;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import lombok.Getter;

/**
 * A user from the static user table. Lives in memory only; the password is
 * held as a BCrypt hash.
 */
@Getter
public class AppUser implements UserDetails {

    private final String username;
    private final String email;
    private final String fullname;
    private final String hashedPassword;
    private final boolean disabled;

    public AppUser(String username, String email, String fullname, String hashedPassword, boolean disabled) {
        this.username = username;
        this.email = email;
        this.fullname = fullname;
        this.hashedPassword = hashedPassword;
        this.disabled = disabled;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(new SimpleGrantedAuthority("ROLE_USER"));
    }

    @Override
    public String getPassword() {
        return hashedPassword;
    }

    @Override
    public boolean isAccountNonExpired() {
        return true;
    }

    @Override
    public boolean isAccountNonLocked() {
        return true;
    }

    @Override
    public boolean isCredentialsNonExpired() {
        return true;
    }

    @Override
    public boolean isEnabled() {
        return !disabled;
    }
}
