package com.lumi.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class NotFoundProblemException extends ProblemException {

    public NotFoundProblemException(String code, String detail) {
        super(HttpStatus.NOT_FOUND, code, detail);
    }

    public NotFoundProblemException(String code, String detail, Map<String, ?> details) {
        super(HttpStatus.NOT_FOUND, code, detail, details);
    }
}
