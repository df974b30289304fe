package com.starscape.todoapp.common.security;

import com.starscape.todoapp.common.config.SecurityProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.security.SecureRandom;

/**
 * BCrypt-backed {@link CredentialHasher}. The cost factor comes from
 * {@code app.security.password.strength}.
 */
@Component
public class BcryptCredentialHasher implements CredentialHasher {

    private static final Logger log = LoggerFactory.getLogger(BcryptCredentialHasher.class);

    private final BCryptPasswordEncoder encoder;

    public BcryptCredentialHasher(SecurityProperties properties) {
        int strength = properties.getPassword().getStrength();
        if (strength < 4 || strength > 31) {
            throw new IllegalStateException("app.security.password.strength must be between 4 and 31");
        }
        this.encoder = new BCryptPasswordEncoder(strength, new SecureRandom());
    }

    @Override
    public String hash(String password) {
        if (password == null || password.isEmpty()) {
            throw new IllegalArgumentException("Password cannot be empty");
        }
        if (exceedsMaxLength(password)) {
            throw new IllegalArgumentException("Password cannot exceed " + MAX_PASSWORD_BYTES + " bytes");
        }
        return encoder.encode(password);
    }

    @Override
    public boolean verify(String password, String digest) {
        if (password == null || password.isEmpty() || digest == null || digest.isEmpty()
                || exceedsMaxLength(password)) {
            return false;
        }
        try {
            // BCrypt.checkpw compares without early return
            return encoder.matches(password, digest);
        } catch (IllegalArgumentException e) {
            log.debug("Rejecting malformed password digest");
            return false;
        }
    }

    private static boolean exceedsMaxLength(String password) {
        return password.getBytes(StandardCharsets.UTF_8).length > MAX_PASSWORD_BYTES;
    }
}
