package com.lumi.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class ValidationProblemException extends ProblemException {

    public ValidationProblemException(String code, String detail) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail);
    }

    public ValidationProblemException(String code, String detail, Map<String, ?> details) {
        super(HttpStatus.UNPROCESSABLE_ENTITY, code, detail, details);
    }
}
