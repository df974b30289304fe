package com.starscape.todoapp.common.security;

import java.time.Instant;

/**
 * Identity carried by a verified session token.
 */
public record TokenPayload(
    long ownerId,
    String email,
    Instant issuedAt,
    Instant expiresAt
) {}
