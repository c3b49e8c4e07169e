package com.lumi.backend.modules.auth.application;

import com.lumi.backend.global.error.ValidationProblemException;

public class MalformedTokenException extends ValidationProblemException {

    public MalformedTokenException(String detail) {
        super("malformed_token", detail);
    }
}
