package com.lumi.backend.global.config;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Component;

/**
 * Fails startup when required secrets are missing or still carry development defaults.
 */
@Component
public class EnvironmentValidator {

    private static final Logger log = LoggerFactory.getLogger(EnvironmentValidator.class);

    static final String DEV_JWT_SECRET = "dev-jwt-secret-key-change-in-production-2025-lumi";
    static final String DEV_FINGERPRINT_SECRET = "dev-fingerprint-secret-change-in-production-lumi";

    private static final String[] REQUIRED_KEYS = {
            "spring.datasource.url",
            "jwt.secret",
            "jwt.expiration",
            "lumi.auth.session.fingerprint-secret",
            "lumi.app.frontend-url"
    };

    private final Environment environment;

    public EnvironmentValidator(Environment environment) {
        this.environment = environment;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void validateEnvironment() {
        List<String> problems = new ArrayList<>();

        for (String key : REQUIRED_KEYS) {
            Optional<String> value = Optional.ofNullable(environment.getProperty(key));
            if (value.map(String::trim).orElse("").isEmpty()) {
                problems.add(key + ": missing");
            }
        }

        boolean strict = environment.getProperty("lumi.env-validation.reject-dev-secrets", Boolean.class, false);
        if (strict && DEV_JWT_SECRET.equals(environment.getProperty("jwt.secret"))) {
            problems.add("jwt.secret: replace the development default with a random value");
        }
        if (strict && DEV_FINGERPRINT_SECRET.equals(environment.getProperty("lumi.auth.session.fingerprint-secret"))) {
            problems.add("lumi.auth.session.fingerprint-secret: replace the development default with a random value");
        }

        Optional<String> jwtExpiration = Optional.ofNullable(environment.getProperty("jwt.expiration"));
        if (jwtExpiration.isPresent()) {
            try {
                long expiration = Long.parseLong(jwtExpiration.get().trim());
                if (expiration < 60000 || expiration > 86400000) {
                    problems.add("jwt.expiration: must be between 60000 and 86400000 milliseconds");
                }
            } catch (NumberFormatException e) {
                problems.add("jwt.expiration: must be numeric");
            }
        }

        if (!problems.isEmpty()) {
            problems.forEach(problem -> log.error("Environment validation failed: {}", problem));
            throw new IllegalStateException("Environment validation failed: " + String.join("; ", problems));
        }

        log.info("Environment validation passed");
    }
}
