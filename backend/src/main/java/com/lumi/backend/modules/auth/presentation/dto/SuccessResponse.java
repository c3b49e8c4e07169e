package com.lumi.backend.modules.auth.presentation.dto;

public record SuccessResponse(boolean success) {

    public static SuccessResponse ok() {
        return new SuccessResponse(true);
    }
}
