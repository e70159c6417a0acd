package careguard.core.model.audit;

/**
 * Action names written by the authentication core.
 */
public final class AuditActions {

    public static final String LOGIN_SUCCESS = "AUTH_LOGIN_SUCCESS";
    public static final String FAILED_LOGIN = "AUTH_FAILED_LOGIN";
    public static final String ACCOUNT_LOCKED = "AUTH_ACCOUNT_LOCKED";
    public static final String RATE_LIMITED = "AUTH_RATE_LIMITED";
    public static final String STORE_UNAVAILABLE = "AUTH_STORE_UNAVAILABLE";
    public static final String MFA_REQUIRED = "AUTH_MFA_REQUIRED";
    public static final String MFA_SUCCESS = "AUTH_MFA_SUCCESS";
    public static final String MFA_FAILED = "AUTH_MFA_FAILED";
    public static final String MFA_EXPIRED = "AUTH_MFA_EXPIRED";
    public static final String LOGOUT = "AUTH_LOGOUT";
    public static final String SESSIONS_REVOKED = "AUTH_SESSIONS_REVOKED";
    public static final String LOCKOUT_CLEARED = "AUTH_LOCKOUT_CLEARED";
    public static final String ACCESS_CHECK = "AUTHZ_CHECK";

    private AuditActions() {}
}
