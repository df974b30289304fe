package com.starscape.todoapp.common.security;

/**
 * One-way password hashing. Only the first {@value #MAX_PASSWORD_BYTES} UTF-8 bytes of a
 * password would reach bcrypt, so longer passwords are refused outright.
 */
public interface CredentialHasher {

    int MAX_PASSWORD_BYTES = 72;

    /**
     * Hashes a password with a freshly generated salt, so hashing the same input
     * twice yields two different digests.
     *
     * @throws IllegalArgumentException if the password is null, empty, or longer than
     *         {@value #MAX_PASSWORD_BYTES} UTF-8 bytes
     */
    String hash(String password);

    /**
     * Checks a password against a digest produced by {@link #hash(String)}.
     * Never throws: malformed digests, empty inputs and over-long passwords simply do not match.
     */
    boolean verify(String password, String digest);
}
