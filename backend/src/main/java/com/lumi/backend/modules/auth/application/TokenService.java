package com.lumi.backend.modules.auth.application;

import java.time.Clock;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.util.Date;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

import com.lumi.backend.global.error.UnauthorizedProblemException;
import com.lumi.backend.modules.auth.application.OpaqueTokenCodec.HashedSecret;
import com.lumi.backend.modules.auth.application.OpaqueTokenCodec.ParsedToken;
import com.lumi.backend.modules.auth.domain.UserAccount;
import com.lumi.backend.modules.auth.domain.UserSession;
import com.lumi.backend.modules.auth.infrastructure.jwt.JwtTokenProvider;
import com.lumi.backend.modules.auth.infrastructure.persistence.UserAccountRepository;

import io.jsonwebtoken.Claims;
import io.jsonwebtoken.ExpiredJwtException;
import io.jsonwebtoken.JwtException;
import io.jsonwebtoken.Jwts;
import io.jsonwebtoken.Jwts.SIG;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.web.server.ResponseStatusException;

/**
 * Issues signed access tokens and opaque, rotating refresh tokens. A refresh token that no longer
 * matches its session's current generation is treated as stolen: the whole account is signed out.
 */
@Service
@Transactional(noRollbackFor = ResponseStatusException.class)
public class TokenService {

    private static final Logger log = LoggerFactory.getLogger(TokenService.class);

    static final String CLAIM_SESSION_ID = "sid";
    static final String CLAIM_EMAIL = "email";
    static final String CLAIM_ROLES = "roles";
    static final String CLAIM_PERMISSIONS = "permissions";

    private final JwtTokenProvider tokenProvider;
    private final SessionService sessionService;
    private final RbacService rbacService;
    private final UserAccountRepository userAccountRepository;
    private final OpaqueTokenCodec tokenCodec;
    private final long accessTokenTtlMillis;
    private final long refreshTokenTtlMillis;
    private final Clock clock;

    public TokenService(
            JwtTokenProvider tokenProvider,
            SessionService sessionService,
            RbacService rbacService,
            UserAccountRepository userAccountRepository,
            OpaqueTokenCodec tokenCodec,
            @Value("${jwt.expiration:900000}") long accessTokenTtlMillis,
            @Value("${jwt.refresh-expiration:604800000}") long refreshTokenTtlMillis,
            Clock clock
    ) {
        this.tokenProvider = tokenProvider;
        this.sessionService = sessionService;
        this.rbacService = rbacService;
        this.userAccountRepository = userAccountRepository;
        this.tokenCodec = tokenCodec;
        this.accessTokenTtlMillis = accessTokenTtlMillis;
        this.refreshTokenTtlMillis = refreshTokenTtlMillis;
        this.clock = clock;
    }

    public GeneratedToken<AccessTokenClaims> generateAccessToken(UserAccount user, UUID sessionId) {
        Instant now = clock.instant();
        Instant expiry = now.plusMillis(accessTokenTtlMillis);
        String tokenId = UUID.randomUUID().toString();
        List<String> roles = rbacService.getUserRoleCodes(user.getId());
        List<String> permissions = rbacService.getUserPermissions(user.getId());

        String token = Jwts.builder()
                .id(tokenId)
                .subject(user.getId().toString())
                .issuedAt(Date.from(now))
                .expiration(Date.from(expiry))
                .claim(CLAIM_SESSION_ID, sessionId.toString())
                .claim(CLAIM_EMAIL, user.getEmail())
                .claim(CLAIM_ROLES, roles)
                .claim(CLAIM_PERMISSIONS, permissions)
                .signWith(tokenProvider.getSecretKey(), SIG.HS256)
                .compact();

        OffsetDateTime expiresAt = OffsetDateTime.ofInstant(expiry, clock.getZone());
        AccessTokenClaims claims = new AccessTokenClaims(
                user.getId(),
                sessionId,
                tokenId,
                user.getEmail(),
                roles,
                permissions,
                OffsetDateTime.ofInstant(now, clock.getZone()),
                expiresAt
        );
        return new GeneratedToken<>(token, claims, expiresAt);
    }

    public IssuedRefreshToken generateRefreshToken(UserAccount user, UUID sessionId) {
        HashedSecret hashedSecret = tokenCodec.generateHashedSecret();
        OffsetDateTime issuedAt = OffsetDateTime.now(clock);
        OffsetDateTime expiresAt = issuedAt.plusNanos(refreshTokenTtlMillis * 1_000_000L);
        RefreshTokenClaims claims = new RefreshTokenClaims(
                user.getId(),
                sessionId,
                UUID.randomUUID().toString(),
                issuedAt,
                expiresAt
        );
        String token = tokenCodec.serialise(sessionId, hashedSecret.secret());
        return new IssuedRefreshToken(new GeneratedToken<>(token, claims, expiresAt), hashedSecret.hash());
    }

    @Transactional(readOnly = true, noRollbackFor = ResponseStatusException.class)
    public AccessTokenClaims verifyAccessToken(String token) {
        AccessTokenClaims claims;
        try {
            Claims payload = Jwts.parser()
                    .verifyWith(tokenProvider.getSecretKey())
                    .clock(() -> Date.from(clock.instant()))
                    .build()
                    .parseSignedClaims(token)
                    .getPayload();
            claims = toAccessClaims(payload);
        } catch (ExpiredJwtException ex) {
            throw new UnauthorizedProblemException("access_token_expired", "Access token has expired");
        } catch (JwtException | IllegalArgumentException | NullPointerException ex) {
            throw new UnauthorizedProblemException("invalid_access_token", "Access token is invalid");
        }

        boolean sessionActive = sessionService.findActiveSession(claims.sessionId())
                .filter(session -> claims.userId().equals(session.getUserId()))
                .isPresent();
        if (!sessionActive) {
            throw new UnauthorizedProblemException("session_revoked", "Session is no longer active");
        }
        return claims;
    }

    public VerifiedRefreshToken verifyRefreshToken(String token) {
        ParsedToken parsed;
        try {
            parsed = tokenCodec.parse(token);
        } catch (MalformedTokenException ex) {
            throw invalidRefreshToken();
        }

        UserSession session = sessionService.findSession(parsed.id())
                .orElseThrow(TokenService::invalidRefreshToken);
        if (session.isRevoked()) {
            throw invalidRefreshToken();
        }
        if (session.isExpiredAt(OffsetDateTime.now(clock))) {
            sessionService.revokeSession(session.getId(), RevocationReasons.EXPIRED);
            throw new UnauthorizedProblemException("refresh_token_expired", "Refresh token has expired");
        }
        if (!tokenCodec.verifySecret(parsed.secret(), session.getRefreshTokenHash())) {
            throw handleReuse(session);
        }

        RefreshTokenClaims claims = new RefreshTokenClaims(
                session.getUserId(),
                session.getId(),
                session.getRefreshTokenId(),
                session.getLastRotatedAt(),
                session.getExpiresAt()
        );
        return new VerifiedRefreshToken(claims, session);
    }

    public RotatedTokens rotateRefreshToken(String token) {
        return rotate(verifyRefreshToken(token));
    }

    public RotatedTokens rotate(VerifiedRefreshToken verified) {
        UserSession session = verified.session();
        UserAccount user = userAccountRepository.findById(session.getUserId())
                .orElseThrow(() -> new UnauthorizedProblemException("invalid_refresh_token", "Refresh token is invalid"));
        if (!user.isActive()) {
            throw new UnauthorizedProblemException("account_inactive", "Account is not active. Please contact support.");
        }

        IssuedRefreshToken next = generateRefreshToken(user, session.getId());
        boolean rotated = sessionService.rotateRefreshToken(
                session.getId(),
                verified.payload().tokenId(),
                next.secretHash(),
                next.token().payload().tokenId(),
                next.token().expiresAt()
        );
        if (!rotated) {
            throw handleReuse(session);
        }

        GeneratedToken<AccessTokenClaims> access = generateAccessToken(user, session.getId());
        log.info("Refresh token rotated for session {} of user {}", session.getId(), user.getId());
        return new RotatedTokens(access, next.token(), session.getId(), user.getId(), verified.payload().tokenId());
    }

    public void revokeToken(UUID sessionId, String reason) {
        sessionService.revokeSession(sessionId, reason);
    }

    private TokenReuseDetectedException handleReuse(UserSession session) {
        UUID userId = session.getUserId();
        int revoked = sessionService.revokeSession(session.getId(), RevocationReasons.REFRESH_TOKEN_HASH_MISMATCH) ? 1 : 0;
        revoked += sessionService.revokeAllUserSessions(userId, RevocationReasons.REFRESH_TOKEN_REPLAY_DETECTED);
        log.warn("Refresh token reuse on session {} of user {}; revoked {} sessions", session.getId(), userId, revoked);
        return new TokenReuseDetectedException(userId, session.getId(), revoked);
    }

    private AccessTokenClaims toAccessClaims(Claims payload) {
        Instant issuedAt = payload.getIssuedAt() != null ? payload.getIssuedAt().toInstant() : clock.instant();
        Instant expiresAt = payload.getExpiration() != null ? payload.getExpiration().toInstant() : issuedAt;
        return new AccessTokenClaims(
                UUID.fromString(payload.getSubject()),
                UUID.fromString(payload.get(CLAIM_SESSION_ID, String.class)),
                payload.getId(),
                payload.get(CLAIM_EMAIL, String.class),
                stringList(payload.get(CLAIM_ROLES, List.class)),
                stringList(payload.get(CLAIM_PERMISSIONS, List.class)),
                OffsetDateTime.ofInstant(issuedAt, clock.getZone()),
                OffsetDateTime.ofInstant(expiresAt, clock.getZone())
        );
    }

    private static List<String> stringList(List<?> raw) {
        if (raw == null) {
            return List.of();
        }
        return raw.stream()
                .filter(Objects::nonNull)
                .map(Object::toString)
                .toList();
    }

    private static UnauthorizedProblemException invalidRefreshToken() {
        return new UnauthorizedProblemException("invalid_refresh_token", "Refresh token is invalid");
    }

    public record AccessTokenClaims(
            UUID userId,
            UUID sessionId,
            String tokenId,
            String email,
            List<String> roles,
            List<String> permissions,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public record RefreshTokenClaims(
            UUID userId,
            UUID sessionId,
            String tokenId,
            OffsetDateTime issuedAt,
            OffsetDateTime expiresAt
    ) {
    }

    public record GeneratedToken<T>(String token, T payload, OffsetDateTime expiresAt) {
    }

    public record IssuedRefreshToken(GeneratedToken<RefreshTokenClaims> token, String secretHash) {
    }

    public record VerifiedRefreshToken(RefreshTokenClaims payload, UserSession session) {
    }

    public record RotatedTokens(
            GeneratedToken<AccessTokenClaims> accessToken,
            GeneratedToken<RefreshTokenClaims> refreshToken,
            UUID sessionId,
            UUID userId,
            String previousTokenId
    ) {
    }
}
