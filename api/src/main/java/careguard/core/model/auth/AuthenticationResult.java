package careguard.core.model.auth;

import java.time.Instant;

/**
 * Outcome of an authentication attempt.
 */
public sealed interface AuthenticationResult {

    /**
     * Credentials verified and a session was issued.
     *
     * @param identity  the authenticated identity
     * @param token     signed bearer token
     * @param expiresAt absolute session expiry
     */
    record Granted(String identity, String token, Instant expiresAt) implements AuthenticationResult {}

    /**
     * Password verified, second factor still outstanding.
     *
     * @param challengeToken short-lived token to present with the MFA code
     * @param expiresAt      when the challenge lapses
     */
    record MfaRequired(String challengeToken, Instant expiresAt) implements AuthenticationResult {}

    /**
     * Attempt rejected.
     *
     * @param failure           the failure category
     * @param retryAfterSeconds hint for rate-limited or locked callers (0 if not applicable)
     */
    record Denied(AuthFailure failure, long retryAfterSeconds) implements AuthenticationResult {

        public static Denied of(AuthFailure failure) {
            return new Denied(failure, 0);
        }
    }

    default boolean granted() {
        return this instanceof Granted;
    }
}
