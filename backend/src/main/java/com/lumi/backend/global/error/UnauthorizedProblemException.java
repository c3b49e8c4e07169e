package com.lumi.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class UnauthorizedProblemException extends ProblemException {

    public UnauthorizedProblemException(String code, String detail) {
        super(HttpStatus.UNAUTHORIZED, code, detail);
    }

    public UnauthorizedProblemException(String code, String detail, Map<String, ?> details) {
        super(HttpStatus.UNAUTHORIZED, code, detail, details);
    }
}
