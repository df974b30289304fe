package com.starscape.todoapp.features.auth.domain;

import java.util.Optional;

/**
 * Storage port for accounts. Email arguments are expected to be normalized already.
 */
public interface AccountRepository {
    Account save(Account account);
    Optional<Account> findById(Long id);
    Optional<Account> findByEmail(String email);
    boolean existsByEmail(String email);
}
