package com.lumi.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.security.SecureRandom;
import java.util.Base64;
import java.util.HexFormat;
import java.util.UUID;
import java.util.regex.Pattern;

import org.springframework.stereotype.Component;

/**
 * Mints and reads the opaque {@code {id}.{secret}} tokens used for refresh, email verification
 * and password reset. Only the SHA-256 of the secret is ever stored.
 */
@Component
public class OpaqueTokenCodec {

    static final String DELIMITER = ".";
    private static final int SECRET_BYTES = 32;
    private static final Pattern SECRET_PATTERN = Pattern.compile("[A-Za-z0-9_\\-]+");

    private final SecureRandom secureRandom = new SecureRandom();

    public HashedSecret generateHashedSecret() {
        byte[] bytes = new byte[SECRET_BYTES];
        secureRandom.nextBytes(bytes);
        String secret = Base64.getUrlEncoder().withoutPadding().encodeToString(bytes);
        return new HashedSecret(secret, hashSecret(secret));
    }

    public String serialise(UUID id, String secret) {
        if (id == null) {
            throw new IllegalArgumentException("id must not be null");
        }
        if (secret == null || secret.isBlank() || secret.contains(DELIMITER)) {
            throw new IllegalArgumentException("secret must be non-blank and must not contain '" + DELIMITER + "'");
        }
        return id + DELIMITER + secret;
    }

    public ParsedToken parse(String token) {
        if (token == null || token.isBlank()) {
            throw new MalformedTokenException("Token is missing");
        }
        String[] parts = token.trim().split(Pattern.quote(DELIMITER), -1);
        if (parts.length != 2 || parts[0].isBlank() || parts[1].isBlank()) {
            throw new MalformedTokenException("Token format is invalid");
        }
        if (!SECRET_PATTERN.matcher(parts[1]).matches()) {
            throw new MalformedTokenException("Token format is invalid");
        }
        UUID id;
        try {
            id = UUID.fromString(parts[0]);
        } catch (IllegalArgumentException ex) {
            throw new MalformedTokenException("Token identifier is invalid");
        }
        return new ParsedToken(id, parts[1]);
    }

    public String hashSecret(String secret) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(secret.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException ex) {
            throw new IllegalStateException("SHA-256 not available", ex);
        }
    }

    public boolean verifySecret(String secret, String storedHash) {
        if (secret == null || storedHash == null) {
            return false;
        }
        byte[] candidate = hashSecret(secret).getBytes(StandardCharsets.US_ASCII);
        byte[] expected = storedHash.getBytes(StandardCharsets.US_ASCII);
        return MessageDigest.isEqual(candidate, expected);
    }

    public record HashedSecret(String secret, String hash) {
    }

    public record ParsedToken(UUID id, String secret) {
    }
}
