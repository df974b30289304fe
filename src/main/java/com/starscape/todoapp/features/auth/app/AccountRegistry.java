package com.starscape.todoapp.features.auth.app;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.common.security.CredentialHasher;
import com.starscape.todoapp.features.auth.domain.Account;
import com.starscape.todoapp.features.auth.domain.AccountRepository;
import com.starscape.todoapp.features.auth.domain.EmailAddress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.Optional;

/**
 * Creates and authenticates accounts.
 */
@Service
public class AccountRegistry {

    private static final Logger log = LoggerFactory.getLogger(AccountRegistry.class);

    static final int MIN_PASSWORD_LENGTH = 8;
    static final String EMAIL_TAKEN = "Email already registered";

    private final AccountRepository accountRepository;
    private final CredentialHasher credentialHasher;
    private final Clock clock;

    // verified against when no account matches, so both failure paths pay for one hash check
    private final String decoyDigest;

    public AccountRegistry(AccountRepository accountRepository, CredentialHasher credentialHasher, Clock clock) {
        this.accountRepository = accountRepository;
        this.credentialHasher = credentialHasher;
        this.clock = clock;
        this.decoyDigest = credentialHasher.hash("decoy-password-never-matches");
    }

    /**
     * Registers a new account. Validation problems come back as INVALID, an email that
     * is already taken (case-insensitively) as CONFLICT. Not transactional itself: the
     * insert runs in the repository's own transaction so a unique-key race can be
     * reported as CONFLICT instead of poisoning an outer transaction.
     */
    public Outcome<Account> register(String email, String password) {
        String normalizedEmail = EmailAddress.normalize(email);
        Optional<String> emailProblem = EmailAddress.validate(normalizedEmail);
        if (emailProblem.isPresent()) {
            return Outcome.invalid(emailProblem.get());
        }
        if (password == null || password.isEmpty()) {
            return Outcome.invalid("Password cannot be empty");
        }
        if (password.length() < MIN_PASSWORD_LENGTH) {
            return Outcome.invalid("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
        }
        if (password.getBytes(StandardCharsets.UTF_8).length > CredentialHasher.MAX_PASSWORD_BYTES) {
            return Outcome.invalid("Password cannot exceed " + CredentialHasher.MAX_PASSWORD_BYTES + " bytes");
        }
        if (accountRepository.existsByEmail(normalizedEmail)) {
            return Outcome.conflict(EMAIL_TAKEN);
        }

        String passwordHash = credentialHasher.hash(password);

        Account saved;
        try {
            saved = accountRepository.save(new Account(normalizedEmail, passwordHash, clock.instant()));
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration for the same address
            return Outcome.conflict(EMAIL_TAKEN);
        }

        log.info("Registered account id={}", saved.getId());
        return Outcome.ok(saved);
    }

    /**
     * Returns the account when the credentials match. An unknown email and a wrong
     * password are indistinguishable to the caller.
     */
    @Transactional(readOnly = true)
    public Optional<Account> authenticate(String email, String password) {
        String normalizedEmail = EmailAddress.normalize(email);
        if (normalizedEmail.isEmpty() || password == null || password.isEmpty()) {
            return Optional.empty();
        }

        Optional<Account> account = accountRepository.findByEmail(normalizedEmail);
        String digest = account.map(Account::getPasswordHash).orElse(decoyDigest);
        boolean matches = credentialHasher.verify(password, digest);

        if (account.isEmpty() || !matches) {
            log.warn("Failed login attempt");
            return Optional.empty();
        }
        return account;
    }

    @Transactional(readOnly = true)
    public Optional<Account> findById(long accountId) {
        return accountRepository.findById(accountId);
    }
}
