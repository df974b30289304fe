package com.starscape.todoapp.common.security;

import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.userdetails.UserDetails;

import java.util.Collection;
import java.util.List;

/**
 * Verified caller identity. Ownership filtering reads the account id from here and
 * from nowhere else.
 */
public class UserPrincipal implements UserDetails {

    private final long accountId;
    private final String email;

    public UserPrincipal(long accountId, String email) {
        this.accountId = accountId;
        this.email = email;
    }

    public long getAccountId() {
        return accountId;
    }

    public String getEmail() {
        return email;
    }

    @Override
    public Collection<? extends GrantedAuthority> getAuthorities() {
        return List.of(); // no roles: ownership is the only access rule
    }

    @Override
    public String getPassword() {
        return null; // Not used with JWT
    }

    @Override
    public String getUsername() {
        return email;
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
        return true;
    }

    @Override
    public String toString() {
        return "UserPrincipal[accountId=" + accountId + "]";
    }
}
