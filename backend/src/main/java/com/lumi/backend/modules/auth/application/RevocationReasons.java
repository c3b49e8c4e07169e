package com.lumi.backend.modules.auth.application;

/**
 * Values written to {@code user_session.revoked_reason}.
 */
public final class RevocationReasons {

    public static final String MANUAL_LOGOUT = "manual_logout";
    public static final String BULK_LOGOUT = "bulk_logout";
    public static final String VERIFICATION_TOKEN_MISMATCH = "verification_token_mismatch";
    public static final String PASSWORD_RESET_TOKEN_MISMATCH = "password_reset_token_mismatch";
    public static final String PASSWORD_RESET = "password_reset";
    public static final String PASSWORD_CHANGE = "password_change";
    public static final String REFRESH_TOKEN_HASH_MISMATCH = "refresh_token_hash_mismatch";
    public static final String REFRESH_TOKEN_REPLAY_DETECTED = "refresh_token_replay_detected";
    public static final String FINGERPRINT_MISMATCH = "fingerprint_mismatch";
    public static final String EXPIRED = "expired";

    private RevocationReasons() {
    }
}
