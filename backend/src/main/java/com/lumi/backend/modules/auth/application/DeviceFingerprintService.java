package com.lumi.backend.modules.auth.application;

import java.nio.charset.StandardCharsets;
import java.security.InvalidKeyException;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.Locale;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.modules.auth.domain.DeviceMetadata;

import org.springframework.stereotype.Component;

/**
 * Keyed hash of user agent and IP address. Sessions remember the fingerprint they were created
 * with so a refresh from a different device can be detected.
 */
@Component
public class DeviceFingerprintService {

    private static final String HMAC_SHA_256 = "HmacSHA256";

    private final SecretKeySpec key;

    public DeviceFingerprintService(AuthProperties authProperties) {
        String secret = authProperties.getSession().getFingerprintSecret();
        if (secret == null || secret.isBlank()) {
            throw new IllegalStateException("lumi.auth.session.fingerprint-secret must be configured");
        }
        this.key = new SecretKeySpec(secret.getBytes(StandardCharsets.UTF_8), HMAC_SHA_256);
    }

    /**
     * @return hex fingerprint, or {@code null} when the device carries no identifying data
     */
    public String fingerprint(DeviceMetadata device) {
        if (device == null || device.isEmpty()) {
            return null;
        }
        String material = normalize(device.userAgent()) + "|" + normalize(device.ipAddress());
        try {
            Mac mac = Mac.getInstance(HMAC_SHA_256);
            mac.init(key);
            return HexFormat.of().formatHex(mac.doFinal(material.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException | InvalidKeyException ex) {
            throw new IllegalStateException("Unable to compute device fingerprint", ex);
        }
    }

    public boolean matches(String storedFingerprint, String candidate) {
        if (storedFingerprint == null || candidate == null) {
            return false;
        }
        return MessageDigest.isEqual(
                storedFingerprint.getBytes(StandardCharsets.US_ASCII),
                candidate.getBytes(StandardCharsets.US_ASCII));
    }

    private static String normalize(String value) {
        return value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
    }
}
