package careguard.core.model.session;

import java.time.Instant;

/**
 * Minimal server-side session record.
 *
 * <p>The bearer token carries everything needed to authorize a request; this
 * record only exists so a session can be revoked before its token expires.
 *
 * @param id        cryptographically random session identifier
 * @param identity  owning account identity
 * @param createdAt issuance timestamp
 * @param expiresAt absolute expiry (sessions are never renewed)
 */
public record Session(String id, String identity, Instant createdAt, Instant expiresAt) {

    public Session {
        if (id == null || id.isBlank()) {
            throw new IllegalArgumentException("Session ID cannot be null or blank");
        }
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Session identity cannot be null or blank");
        }
    }

    public Session withId(String id) {
        return new Session(id, identity, createdAt, expiresAt);
    }

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
