package careguard.core.model.session;

import java.time.Instant;
import java.util.Set;

/**
 * Decoded contents of a bearer token.
 *
 * @param identity    account identity (JWT {@code sub})
 * @param role        account role
 * @param permissions explicit permissions granted to the account
 * @param sessionId   session identifier (JWT {@code sid})
 * @param issuedAt    issuance time
 * @param expiresAt   token expiry
 */
public record SessionClaims(
        String identity, String role, Set<String> permissions, String sessionId, Instant issuedAt, Instant expiresAt) {

    public SessionClaims {
        if (permissions == null) {
            permissions = Set.of();
        } else {
            permissions = Set.copyOf(permissions);
        }
    }
}
