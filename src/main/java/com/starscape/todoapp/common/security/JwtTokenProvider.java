package com.starscape.todoapp.common.security;

import com.starscape.todoapp.common.config.SecurityProperties;
import io.jsonwebtoken.Claims;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.security.Keys;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import javax.crypto.SecretKey;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.Locale;
import java.util.Optional;

/**
 * Issues and verifies HS256-signed session tokens. Verification is stateless:
 * there is no revocation list, expiry is the only way a token stops working.
 */
@Component
public class JwtTokenProvider {

    private static final Logger log = LoggerFactory.getLogger(JwtTokenProvider.class);

    static final String CLAIM_USER_ID = "user_id";
    static final String CLAIM_EMAIL = "email";

    private final SecretKey secretKey;
    private final Duration ttl;
    private final String issuer;
    private final Clock clock;

    public JwtTokenProvider(SecurityProperties properties, Clock clock) {
        SecurityProperties.Jwt jwt = properties.getJwt();
        if (jwt.getSecret() == null) {
            throw new IllegalStateException("app.security.jwt.secret must be set");
        }
        byte[] secret = jwt.getSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < 32) { // HS256 needs at least a 256-bit key
            throw new IllegalStateException("app.security.jwt.secret must be at least 32 bytes");
        }
        if (jwt.getTtl() == null || jwt.getTtl().isNegative() || jwt.getTtl().isZero()) {
            throw new IllegalStateException("app.security.jwt.ttl must be positive");
        }
        this.secretKey = Keys.hmacShaKeyFor(secret);
        this.ttl = jwt.getTtl();
        this.issuer = jwt.getIssuer();
        this.clock = clock;
    }

    /**
     * Mints a token for the given account.
     *
     * @throws IllegalArgumentException if ownerId is not positive or email is blank
     */
    public String issue(long ownerId, String email) {
        if (ownerId <= 0) {
            throw new IllegalArgumentException("ownerId must be a positive integer");
        }
        if (email == null || email.isBlank()) {
            throw new IllegalArgumentException("email cannot be empty");
        }

        Instant now = clock.instant();
        Instant expiration = now.plus(ttl);

        return Jwts.builder()
                .subject(Long.toString(ownerId))
                .claim(CLAIM_USER_ID, ownerId)
                .claim(CLAIM_EMAIL, email.trim().toLowerCase(Locale.ROOT))
                .issuer(issuer)
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiration))
                .signWith(secretKey, Jwts.SIG.HS256)
                .compact();
    }

    /**
     * Verifies signature, structure and expiry. Returns empty for any token that
     * is not currently valid; never throws.
     */
    public Optional<TokenPayload> verify(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }

        Claims claims;
        try {
            claims = Jwts.parser()
                    .verifyWith(secretKey)
                    .requireIssuer(issuer)
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token.trim())
                    .getPayload();
        } catch (JwtException | IllegalArgumentException e) {
            log.debug("Rejected token: {}", e.getClass().getSimpleName());
            return Optional.empty();
        }

        Number ownerId = readOwnerId(claims);
        String email = claims.get(CLAIM_EMAIL) instanceof String s ? s : null;
        Date issuedAt = claims.getIssuedAt();
        Date expiresAt = claims.getExpiration();
        if (ownerId == null || ownerId.longValue() <= 0 || email == null || email.isBlank()
                || issuedAt == null || expiresAt == null) {
            log.debug("Rejected token with incomplete payload");
            return Optional.empty();
        }

        // expired once now >= exp; the parser alone only rejects now > exp
        if (!clock.instant().isBefore(expiresAt.toInstant())) {
            log.debug("Rejected token at expiry boundary");
            return Optional.empty();
        }

        return Optional.of(new TokenPayload(
                ownerId.longValue(), email, issuedAt.toInstant(), expiresAt.toInstant()));
    }

    public Duration getTtl() {
        return ttl;
    }

    private static Number readOwnerId(Claims claims) {
        Object raw = claims.get(CLAIM_USER_ID);
        if (raw instanceof Integer || raw instanceof Long) {
            return (Number) raw;
        }
        return null;
    }
}
