package com.starscape.todoapp.common.security;

import com.starscape.todoapp.common.config.SecurityProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class BcryptCredentialHasherTest {

    private BcryptCredentialHasher hasher;

    @BeforeEach
    void setUp() {
        SecurityProperties properties = new SecurityProperties();
        properties.getPassword().setStrength(4);
        hasher = new BcryptCredentialHasher(properties);
    }

    @Test
    void hashedPasswordVerifies() {
        String digest = hasher.hash("password123");

        assertNotEquals("password123", digest);
        assertTrue(hasher.verify("password123", digest));
    }

    @Test
    void hashingTwiceUsesFreshSalt() {
        String first = hasher.hash("password123");
        String second = hasher.hash("password123");

        assertNotEquals(first, second);
        assertTrue(hasher.verify("password123", first));
        assertTrue(hasher.verify("password123", second));
    }

    @Test
    void differentPasswordDoesNotVerify() {
        String digest = hasher.hash("password123");

        assertFalse(hasher.verify("password124", digest));
        assertFalse(hasher.verify("PASSWORD123", digest));
    }

    @Test
    void emptyPasswordCannotBeHashed() {
        assertThrows(IllegalArgumentException.class, () -> hasher.hash(""));
        assertThrows(IllegalArgumentException.class, () -> hasher.hash(null));
    }

    @Test
    void verifyRejectsEmptyAndMalformedInputsWithoutThrowing() {
        String digest = hasher.hash("password123");

        assertFalse(hasher.verify("", digest));
        assertFalse(hasher.verify(null, digest));
        assertFalse(hasher.verify("password123", ""));
        assertFalse(hasher.verify("password123", null));
        assertFalse(hasher.verify("password123", "not-a-bcrypt-digest"));
        assertFalse(hasher.verify("password123", "$2a$04$short"));
    }

    @Test
    void passwordsBeyondBcryptInputLimitAreRefused() {
        String prefix = "a".repeat(72);
        String digest = hasher.hash(prefix);

        assertThrows(IllegalArgumentException.class, () -> hasher.hash(prefix + "b"));
        assertFalse(hasher.verify(prefix + "b", digest));
        assertThrows(IllegalArgumentException.class, () -> hasher.hash("\u00e9".repeat(37)));
        assertTrue(hasher.verify("\u00e9".repeat(36), hasher.hash("\u00e9".repeat(36))));
    }

    @Test
    void digestEmbedsConfiguredCostFactor() {
        assertTrue(hasher.hash("password123").startsWith("$2a$04$"));
    }

    @Test
    void outOfRangeStrengthIsRejected() {
        SecurityProperties properties = new SecurityProperties();
        properties.getPassword().setStrength(3);

        assertThrows(IllegalStateException.class, () -> new BcryptCredentialHasher(properties));
    }
}
