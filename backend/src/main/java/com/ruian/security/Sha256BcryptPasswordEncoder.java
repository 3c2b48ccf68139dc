package com.ruian.security;

import org.springframework.security.crypto.bcrypt.BCrypt;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;

/**
 * bcrypt over the raw 32-byte SHA-256 digest of the UTF-8 password.
 *
 * The pre-hash keeps every input under bcrypt's 72-byte limit and matches
 * the hashes already stored in the users table.
 */
public class Sha256BcryptPasswordEncoder implements PasswordEncoder {

    public static final int DEFAULT_COST = 12;

    private final int cost;

    public Sha256BcryptPasswordEncoder() {
        this(DEFAULT_COST);
    }

    public Sha256BcryptPasswordEncoder(int cost) {
        if (cost < 4 || cost > 31) {
            throw new IllegalArgumentException("bcrypt cost must be between 4 and 31, got " + cost);
        }
        this.cost = cost;
    }

    @Override
    public String encode(CharSequence rawPassword) {
        if (rawPassword == null) {
            throw new IllegalArgumentException("Password cannot be null");
        }
        return BCrypt.hashpw(prehash(rawPassword), BCrypt.gensalt(cost));
    }

    @Override
    public boolean matches(CharSequence rawPassword, String encodedPassword) {
        if (rawPassword == null || encodedPassword == null || !encodedPassword.startsWith("$2")) {
            return false;
        }
        try {
            return BCrypt.checkpw(prehash(rawPassword), encodedPassword);
        } catch (IllegalArgumentException ex) {
            // malformed stored hash
            return false;
        }
    }

    static byte[] prehash(CharSequence rawPassword) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return digest.digest(rawPassword.toString().getBytes(StandardCharsets.UTF_8));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 is not available", ex);
        }
    }
}
