package com.lumi.backend.modules.auth.application;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.lumi.backend.global.config.AuthProperties;
import com.lumi.backend.modules.auth.domain.DeviceMetadata;

import org.junit.jupiter.api.Test;

class DeviceFingerprintServiceTest {

    private static final String SECRET = "test-fingerprint-secret-0123456789abcdef";

    private final DeviceFingerprintService service = new DeviceFingerprintService(properties(SECRET));

    @Test
    void sameDeviceProducesSameFingerprint() {
        String first = service.fingerprint(new DeviceMetadata("203.0.113.7", "Mozilla/5.0 Firefox"));
        String second = service.fingerprint(new DeviceMetadata(" 203.0.113.7 ", "MOZILLA/5.0 FIREFOX"));

        assertThat(first).hasSize(64).isEqualTo(second);
        assertThat(service.matches(first, second)).isTrue();
    }

    @Test
    void differentAddressOrAgentChangesFingerprint() {
        String original = service.fingerprint(new DeviceMetadata("203.0.113.7", "Mozilla/5.0 Firefox"));

        assertThat(service.fingerprint(new DeviceMetadata("198.51.100.2", "Mozilla/5.0 Firefox"))).isNotEqualTo(original);
        assertThat(service.fingerprint(new DeviceMetadata("203.0.113.7", "curl/8.0"))).isNotEqualTo(original);
    }

    @Test
    void fingerprintDependsOnSecret() {
        DeviceMetadata device = new DeviceMetadata("203.0.113.7", "Mozilla/5.0 Firefox");
        DeviceFingerprintService other = new DeviceFingerprintService(properties(SECRET + "-rotated"));

        assertThat(other.fingerprint(device)).isNotEqualTo(service.fingerprint(device));
    }

    @Test
    void emptyDeviceHasNoFingerprintAndNeverMatches() {
        assertThat(service.fingerprint(null)).isNull();
        assertThat(service.fingerprint(DeviceMetadata.unknown())).isNull();
        assertThat(service.matches(null, null)).isFalse();
        assertThat(service.matches("abc", null)).isFalse();
    }

    @Test
    void requiresConfiguredSecret() {
        assertThatThrownBy(() -> new DeviceFingerprintService(properties(" ")))
                .isInstanceOf(IllegalStateException.class);
    }

    private static AuthProperties properties(String secret) {
        AuthProperties properties = new AuthProperties();
        properties.getSession().setFingerprintSecret(secret);
        return properties;
    }
}
