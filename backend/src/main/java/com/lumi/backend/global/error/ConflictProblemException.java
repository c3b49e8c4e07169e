package com.lumi.backend.global.error;

import java.util.Map;

import org.springframework.http.HttpStatus;

public class ConflictProblemException extends ProblemException {

    public ConflictProblemException(String code, String detail) {
        super(HttpStatus.CONFLICT, code, detail);
    }

    public ConflictProblemException(String code, String detail, Map<String, ?> details) {
        super(HttpStatus.CONFLICT, code, detail, details);
    }
}
