package com.starscape.todoapp.features.auth.app;

import com.starscape.todoapp.common.security.JwtTokenProvider;
import com.starscape.todoapp.common.security.TokenPayload;
import com.starscape.todoapp.common.security.UserPrincipal;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Turns a raw bearer credential into a verified identity. The identity it returns
 * is the only owner id that item operations ever see.
 */
@Component
public class SessionGuard {

    private static final Logger log = LoggerFactory.getLogger(SessionGuard.class);

    private static final String BEARER_SCHEME = "Bearer";

    private final JwtTokenProvider tokenProvider;
    private final AccountRegistry accountRegistry;

    public SessionGuard(JwtTokenProvider tokenProvider, AccountRegistry accountRegistry) {
        this.tokenProvider = tokenProvider;
        this.accountRegistry = accountRegistry;
    }

    /**
     * Accepts either a bare token or an Authorization header value ("Bearer &lt;token&gt;").
     * Empty when the token is missing, malformed, forged, expired, or names an account
     * that no longer exists.
     */
    public Optional<UserPrincipal> authenticate(String credential) {
        String token = stripScheme(credential);
        if (token.isEmpty()) {
            return Optional.empty();
        }

        Optional<TokenPayload> payload = tokenProvider.verify(token);
        if (payload.isEmpty()) {
            return Optional.empty();
        }

        long ownerId = payload.get().ownerId();
        Optional<UserPrincipal> principal = accountRegistry.findById(ownerId)
                .map(account -> new UserPrincipal(account.getId(), account.getEmail()));
        if (principal.isEmpty()) {
            log.debug("Token names unknown account id={}", ownerId);
        }
        return principal;
    }

    static String stripScheme(String credential) {
        if (credential == null) {
            return "";
        }
        String value = credential.strip();
        int schemeLength = BEARER_SCHEME.length();
        if (value.regionMatches(true, 0, BEARER_SCHEME, 0, schemeLength)
                && (value.length() == schemeLength || Character.isWhitespace(value.charAt(schemeLength)))) {
            value = value.substring(schemeLength).strip();
        }
        return value;
    }
}
