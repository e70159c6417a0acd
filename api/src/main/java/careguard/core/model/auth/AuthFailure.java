package careguard.core.model.auth;

/**
 * Caller-visible failure taxonomy for authentication and authorization.
 *
 * <p>Messages are deliberately coarse. {@link #INVALID_CREDENTIALS} never says
 * whether the identity exists.
 */
public enum AuthFailure {
    RATE_LIMITED("Too many attempts, please retry later"),
    INVALID_CREDENTIALS("Invalid credentials"),
    ACCOUNT_LOCKED("Account is temporarily locked"),
    MFA_REQUIRED("Multi-factor verification required"),
    MFA_FAILED("Verification failed"),
    SESSION_EXPIRED("Session is no longer valid"),
    SESSION_INVALID("Session is no longer valid"),
    STORE_UNAVAILABLE("Service temporarily unavailable");

    private final String callerMessage;

    AuthFailure(String callerMessage) {
        this.callerMessage = callerMessage;
    }

    public String callerMessage() {
        return callerMessage;
    }
}
