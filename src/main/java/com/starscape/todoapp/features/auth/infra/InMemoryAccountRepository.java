package com.starscape.todoapp.features.auth.infra;

import com.starscape.todoapp.features.auth.domain.Account;
import com.starscape.todoapp.features.auth.domain.AccountRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DuplicateKeyException;
import org.springframework.stereotype.Repository;

import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Process-local account store. Email uniqueness is enforced by the email index,
 * so two racing registrations for one address cannot both succeed.
 */
@Repository
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "memory")
public class InMemoryAccountRepository implements AccountRepository {

    private final Map<Long, Account> byId = new ConcurrentHashMap<>();
    private final Map<String, Long> idByEmail = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Account save(Account account) {
        if (!account.isNew()) {
            byId.put(account.getId(), account);
            return account;
        }
        long id = sequence.incrementAndGet();
        if (idByEmail.putIfAbsent(account.getEmail(), id) != null) {
            throw new DuplicateKeyException("Email already registered");
        }
        Account stored = new Account(id, account.getEmail(), account.getPasswordHash(), account.getCreatedAt());
        byId.put(id, stored);
        return stored;
    }

    @Override
    public Optional<Account> findById(Long id) {
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public Optional<Account> findByEmail(String email) {
        Long id = idByEmail.get(email);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public boolean existsByEmail(String email) {
        return idByEmail.containsKey(email);
    }
}
