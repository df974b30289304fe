package com.starscape.todoapp.features.auth.app;

import com.starscape.todoapp.common.domain.Outcome;
import com.starscape.todoapp.common.security.JwtTokenProvider;
import com.starscape.todoapp.features.auth.api.dto.AccountResponse;
import com.starscape.todoapp.features.auth.api.dto.LoginRequest;
import com.starscape.todoapp.features.auth.api.dto.LoginResponse;
import com.starscape.todoapp.features.auth.api.dto.RegisterRequest;
import org.springframework.stereotype.Service;

import java.util.Optional;

@Service
public class AuthService {

    private final AccountRegistry accountRegistry;
    private final JwtTokenProvider tokenProvider;

    public AuthService(AccountRegistry accountRegistry, JwtTokenProvider tokenProvider) {
        this.accountRegistry = accountRegistry;
        this.tokenProvider = tokenProvider;
    }

    public Outcome<AccountResponse> register(RegisterRequest request) {
        return accountRegistry.register(request.email(), request.password())
                .map(AccountResponse::from);
    }

    /**
     * Empty when the credentials do not match any account.
     */
    public Optional<LoginResponse> login(LoginRequest request) {
        return accountRegistry.authenticate(request.email(), request.password())
                .map(account -> LoginResponse.bearer(
                        tokenProvider.issue(account.getId(), account.getEmail()),
                        tokenProvider.getTtl().toSeconds()));
    }

    public Optional<AccountResponse> currentAccount(long accountId) {
        return accountRegistry.findById(accountId).map(AccountResponse::from);
    }
}
