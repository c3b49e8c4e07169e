package com.lumi.backend.modules.auth.application;

import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

@Component
public class PasswordHasher {

    private final PasswordEncoder passwordEncoder;
    private final String dummyHash;

    public PasswordHasher(PasswordEncoder passwordEncoder) {
        this.passwordEncoder = passwordEncoder;
        this.dummyHash = passwordEncoder.encode("lumi-timing-equalizer");
    }

    public String hash(String plaintext) {
        if (plaintext == null || plaintext.isBlank()) {
            throw new IllegalArgumentException("password must not be blank");
        }
        return passwordEncoder.encode(plaintext);
    }

    /**
     * Checks a password against a stored hash. A missing hash still costs one BCrypt comparison
     * and always fails.
     */
    public boolean verify(String plaintext, String storedHash) {
        String candidate = plaintext != null ? plaintext : "";
        if (storedHash == null || storedHash.isBlank()) {
            passwordEncoder.matches(candidate, dummyHash);
            return false;
        }
        return passwordEncoder.matches(candidate, storedHash);
    }
}
