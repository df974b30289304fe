package com.starscape.todoapp.features.auth.domain;

import com.starscape.todoapp.common.domain.Entity;
import jakarta.persistence.*;
import java.time.Instant;
import java.util.Objects;

/**
 * A registered user. The email is stored normalized and is unique across all accounts.
 * The password hash never leaves the auth feature.
 */
@jakarta.persistence.Entity
@Table(name = "accounts")
public class Account extends Entity<Long> {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, unique = true, length = 255)
    private String email;

    @Column(name = "password_hash", nullable = false, length = 255)
    private String passwordHash;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    protected Account() {
        // JPA constructor
    }

    /**
     * Creates an account that has not been persisted yet; the store assigns the id.
     */
    public Account(String email, String passwordHash, Instant createdAt) {
        this(null, email, passwordHash, createdAt);
    }

    public Account(Long id, String email, String passwordHash, Instant createdAt) {
        this.id = id;
        this.email = Objects.requireNonNull(email);
        this.passwordHash = Objects.requireNonNull(passwordHash);
        this.createdAt = Objects.requireNonNull(createdAt);
    }

    @Override
    public Long getId() {
        return id;
    }

    public String getEmail() {
        return email;
    }

    public String getPasswordHash() {
        return passwordHash;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    @Override
    public String toString() {
        return "Account[id=" + id + "]";
    }
}
