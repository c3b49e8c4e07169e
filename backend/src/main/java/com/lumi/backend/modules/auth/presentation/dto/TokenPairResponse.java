package com.lumi.backend.modules.auth.presentation.dto;

import java.time.Duration;
import java.time.OffsetDateTime;

import com.lumi.backend.modules.auth.application.TokenService.AccessTokenClaims;
import com.lumi.backend.modules.auth.application.TokenService.GeneratedToken;
import com.lumi.backend.modules.auth.application.TokenService.RefreshTokenClaims;

public record TokenPairResponse(
        String accessToken,
        String tokenType,
        long expiresIn,
        OffsetDateTime accessTokenExpiresAt,
        String refreshToken,
        long refreshExpiresIn,
        OffsetDateTime refreshTokenExpiresAt,
        OffsetDateTime issuedAt
) {
    public static final String DEFAULT_TOKEN_TYPE = "Bearer";

    public static TokenPairResponse of(GeneratedToken<AccessTokenClaims> access,
                                       GeneratedToken<RefreshTokenClaims> refresh) {
        OffsetDateTime issuedAt = access.payload().issuedAt();
        return new TokenPairResponse(
                access.token(),
                DEFAULT_TOKEN_TYPE,
                Duration.between(issuedAt, access.expiresAt()).getSeconds(),
                access.expiresAt(),
                refresh.token(),
                Duration.between(issuedAt, refresh.expiresAt()).getSeconds(),
                refresh.expiresAt(),
                issuedAt
        );
    }
}
