package com.starscape.todoapp.features.auth.infra;

import com.starscape.todoapp.features.auth.domain.Account;
import com.starscape.todoapp.features.auth.domain.AccountRepository;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;

@Repository
@ConditionalOnProperty(name = "app.storage.backend", havingValue = "jpa", matchIfMissing = true)
public interface JpaAccountRepository extends JpaRepository<Account, Long>, AccountRepository {

    @Override
    Optional<Account> findByEmail(String email);

    @Override
    boolean existsByEmail(String email);
}
