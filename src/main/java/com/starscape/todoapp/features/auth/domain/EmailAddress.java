package com.starscape.todoapp.features.auth.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Email normalization and shape rules shared by registration and login.
 */
public final class EmailAddress {

    private EmailAddress() {
    }

    /**
     * Trims and lowercases. Returns an empty string for null.
     */
    public static String normalize(String email) {
        return email == null ? "" : email.trim().toLowerCase(Locale.ROOT);
    }

    /**
     * Checks an already normalized address. Returns the reason it is rejected, or empty
     * when acceptable: exactly one '@', non-empty local and domain parts, and a '.' in the domain.
     */
    public static Optional<String> validate(String normalized) {
        if (normalized.isEmpty()) {
            return Optional.of("Email cannot be empty");
        }
        int at = normalized.indexOf('@');
        if (at <= 0 || at != normalized.lastIndexOf('@') || at == normalized.length() - 1) {
            return Optional.of("Invalid email format");
        }
        if (normalized.indexOf('.', at + 1) < 0) {
            return Optional.of("Invalid email format");
        }
        return Optional.empty();
    }
}
