package com.starscape.todoapp.features.auth.api.dto;

import com.starscape.todoapp.features.auth.domain.Account;

import java.time.Instant;

/**
 * Public view of an account; never carries the password hash.
 */
public record AccountResponse(
    long id,
    String email,
    Instant createdAt
) {
    public static AccountResponse from(Account account) {
        return new AccountResponse(account.getId(), account.getEmail(), account.getCreatedAt());
    }
}
