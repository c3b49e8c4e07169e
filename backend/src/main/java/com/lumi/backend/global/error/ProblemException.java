package com.lumi.backend.global.error;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

/**
 * Domain error rendered as a problem response. {@link #getReason()} returns the machine code;
 * {@link #getDetails()} always carries that code under {@code reason}.
 */
public class ProblemException extends ResponseStatusException {

    private static final String DEFAULT_TYPE_PREFIX = "urn:problem:lumi:";

    private final String code;
    private final String detail;
    private final String type;
    private final Map<String, Object> details;

    public ProblemException(HttpStatus status, String code) {
        this(status, code, null, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail) {
        this(status, code, detail, Map.of());
    }

    public ProblemException(HttpStatus status, String code, String detail, Map<String, ?> details) {
        super(status, code);
        if (code == null || code.isBlank()) {
            throw new IllegalArgumentException("ProblemException code must not be blank");
        }
        this.code = code;
        this.detail = (detail != null && !detail.isBlank()) ? detail : code;
        String normalized = code.toLowerCase().replaceAll("[^a-z0-9\\-_.:]+", "-");
        this.type = DEFAULT_TYPE_PREFIX + normalized;

        Map<String, Object> merged = new LinkedHashMap<>();
        merged.put("reason", code);
        if (details != null) {
            details.forEach((key, value) -> {
                if (value != null) {
                    merged.put(key, value);
                }
            });
        }
        this.details = Collections.unmodifiableMap(merged);
    }

    public String getCode() {
        return code;
    }

    public String getDetailMessage() {
        return detail;
    }

    public String getProblemType() {
        return type;
    }

    public Map<String, Object> getDetails() {
        return details;
    }
}
