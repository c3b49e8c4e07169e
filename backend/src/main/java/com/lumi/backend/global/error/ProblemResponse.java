package com.lumi.backend.global.error;

import java.util.Map;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProblemResponse(
        String type,
        String title,
        int status,
        String detail,
        String instance,
        String code,
        Map<String, Object> details
) {

    private static final String DEFAULT_TYPE_PREFIX = "https://lumi.app/errors/";

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance) {
        return of(httpStatus, code, detail, instance, null);
    }

    public static ProblemResponse of(HttpStatus httpStatus, String code, String detail, String instance,
                                     Map<String, Object> details) {
        String safeCode = (code != null && !code.isBlank()) ? code : httpStatus.name();
        String normalized = safeCode.toLowerCase().replaceAll("[^a-z0-9\\-_.]+", "-");
        String safeDetail = (detail != null && !detail.isBlank()) ? detail : httpStatus.getReasonPhrase();
        String type = DEFAULT_TYPE_PREFIX + normalized;
        Map<String, Object> safeDetails = (details == null || details.isEmpty()) ? null : details;
        return new ProblemResponse(type, httpStatus.getReasonPhrase(), httpStatus.value(), safeDetail, instance,
                safeCode, safeDetails);
    }
}
