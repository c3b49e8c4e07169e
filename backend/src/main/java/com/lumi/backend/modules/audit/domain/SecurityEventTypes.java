package com.lumi.backend.modules.audit.domain;

public final class SecurityEventTypes {

    public static final String REGISTRATION_SUCCESS = "registration_success";
    public static final String LOGIN_FAILED = "login_failed";
    public static final String LOGIN_CAPTCHA_THRESHOLD = "login_captcha_threshold";
    public static final String LOGIN_BLOCKED_INACTIVE = "login_blocked_inactive";
    public static final String LOGIN_BLOCKED_LOCKED = "login_blocked_locked";
    public static final String ACCOUNT_LOCKED = "account_locked";
    public static final String LOGIN_SUCCESS = "login_success";
    public static final String TOKEN_REFRESHED = "token_refreshed";
    public static final String LOGOUT = "logout";
    public static final String LOGOUT_ALL = "logout_all";
    public static final String EMAIL_VERIFIED = "email_verified";
    public static final String EMAIL_VERIFICATION_RESENT = "email_verification_resent";
    public static final String PASSWORD_RESET_REQUESTED = "password_reset_requested";
    public static final String PASSWORD_RESET_COMPLETED = "password_reset_completed";
    public static final String PASSWORD_CHANGED = "password_changed";
    public static final String REFRESH_TOKEN_REPLAY_DETECTED = "refresh_token_replay_detected";
    public static final String SESSION_FINGERPRINT_MISMATCH = "session_fingerprint_mismatch";
    public static final String SESSION_REVOKED = "session_revoked";
    public static final String ACCOUNT_UNLOCK_MANUAL = "account_unlock_manual";

    private SecurityEventTypes() {
    }
}
