package com.starscape.todoapp.features.auth.api;

import com.starscape.todoapp.common.exception.GlobalExceptionHandler.ErrorResponse;
import com.starscape.todoapp.common.exception.OutcomeResponses;
import com.starscape.todoapp.common.security.UserPrincipal;
import com.starscape.todoapp.features.auth.api.dto.AccountResponse;
import com.starscape.todoapp.features.auth.api.dto.LoginRequest;
import com.starscape.todoapp.features.auth.api.dto.RegisterRequest;
import com.starscape.todoapp.features.auth.app.AuthService;
import jakarta.validation.Valid;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.time.Instant;
import java.util.function.Function;

@RestController
@RequestMapping("/api/auth")
public class AuthController {

    private final AuthService authService;

    public AuthController(AuthService authService) {
        this.authService = authService;
    }

    @PostMapping("/register")
    public ResponseEntity<?> register(@Valid @RequestBody RegisterRequest request) {
        return OutcomeResponses.created(authService.register(request), Function.identity());
    }

    @PostMapping("/login")
    public ResponseEntity<?> login(@Valid @RequestBody LoginRequest request) {
        return authService.login(request)
                .<ResponseEntity<?>>map(ResponseEntity::ok)
                .orElseGet(AuthController::invalidCredentials);
    }

    /**
     * Account behind the bearer token.
     */
    @GetMapping("/me")
    public ResponseEntity<AccountResponse> me(@AuthenticationPrincipal UserPrincipal principal) {
        return ResponseEntity.of(authService.currentAccount(principal.getAccountId()));
    }

    private static ResponseEntity<?> invalidCredentials() {
        return ResponseEntity.status(HttpStatus.UNAUTHORIZED)
                .header(HttpHeaders.WWW_AUTHENTICATE, "Bearer")
                .body(new ErrorResponse("UNAUTHORIZED", "Incorrect email or password", null, Instant.now()));
    }
}
