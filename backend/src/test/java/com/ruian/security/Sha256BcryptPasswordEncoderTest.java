package com.ruian.security;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("Sha256BcryptPasswordEncoder Unit Tests")
class Sha256BcryptPasswordEncoderTest {

    // low cost keeps the tests fast
    private final Sha256BcryptPasswordEncoder encoder = new Sha256BcryptPasswordEncoder(4);

    @Test
    @DisplayName("encode should produce a salted bcrypt hash that matches the password")
    void testEncodeAndMatch() {
        String first = encoder.encode("secret123");
        String second = encoder.encode("secret123");

        assertTrue(first.startsWith("$2a$04$"));
        assertNotEquals(first, second);
        assertTrue(encoder.matches("secret123", first));
        assertTrue(encoder.matches("secret123", second));
        assertFalse(encoder.matches("secret124", first));
    }

    @Test
    @DisplayName("passwords longer than 72 bytes should be fully significant")
    void testLongPasswords() {
        String base = "a".repeat(80);
        String hash = encoder.encode(base + "X");

        assertTrue(encoder.matches(base + "X", hash));
        assertFalse(encoder.matches(base + "Y", hash));
    }

    @Test
    @DisplayName("matches should return false for null input or a non-bcrypt hash")
    void testMatches_InvalidInput() {
        assertFalse(encoder.matches(null, "$2a$04$abc"));
        assertFalse(encoder.matches("secret123", null));
        assertFalse(encoder.matches("secret123", "plain-text"));
        assertFalse(encoder.matches("secret123", "$2a$04$tooShort"));
    }

    @Test
    @DisplayName("the default cost should be 12")
    void testDefaultCost() {
        assertTrue(new Sha256BcryptPasswordEncoder().encode("secret123").startsWith("$2a$12$"));
    }

    @Test
    @DisplayName("constructor should reject an out-of-range cost")
    void testInvalidCost() {
        assertThrows(IllegalArgumentException.class, () -> new Sha256BcryptPasswordEncoder(3));
        assertThrows(IllegalArgumentException.class, () -> new Sha256BcryptPasswordEncoder(32));
    }
}
