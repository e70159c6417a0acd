package careguard.core.port.in;

import io.smallrye.mutiny.Uni;

import careguard.core.model.account.Account;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.session.IssuedSession;
import careguard.core.model.session.SessionClaims;
import careguard.core.model.session.SessionValidationResult;

/**
 * Inbound port for session lifecycle operations.
 */
public interface SessionManagement {

    /**
     * Persist a new session for the account and sign its bearer token.
     *
     * @param account authenticated account
     * @return the stored session and its token
     */
    Uni<IssuedSession> issue(Account account);

    /**
     * Validate a bearer token: signature and own expiry first, then the
     * session registry. Both must pass.
     *
     * @param token bearer token
     * @return valid claims, or expired/invalid with a reason for logging; fails
     *         with {@code StoreUnavailableException} when the session store cannot answer
     */
    Uni<SessionValidationResult> validate(String token);

    /**
     * Revoke a session. Idempotent.
     *
     * @param sessionId session identifier
     * @return Uni completing when revoked
     */
    Uni<Void> revoke(String sessionId);

    /**
     * Revoke every session of an identity.
     *
     * @param identity account identity
     * @return number of sessions revoked
     */
    Uni<Integer> revokeAll(String identity);

    /**
     * Revoke the caller's own session and audit the logout.
     *
     * @param claims validated claims of the session being closed
     * @param client request origin
     * @return Uni completing when revoked
     */
    Uni<Void> logout(SessionClaims claims, ClientInfo client);

    /**
     * Revoke every session of an identity on behalf of an administrator and
     * audit the revocation.
     *
     * @param identity account identity
     * @param actor    administrator performing the action
     * @return number of sessions revoked
     */
    Uni<Integer> revokeAll(String identity, String actor);
}
