package careguard.core.model.account;

import java.time.Instant;
import java.util.Locale;
import java.util.Set;

/**
 * A user record as held by the external credential store.
 *
 * <p>The core reads accounts and conditionally updates their failure state;
 * it never creates or deletes them.
 *
 * @param identity        normalised email address
 * @param credentialHash  adaptive (bcrypt) hash of the secret
 * @param role            role name used to resolve role permissions
 * @param permissions     explicit {@code resource:action} grants
 * @param failedAttempts  consecutive failed verifications
 * @param lockExpiry      when the active lock ends (null if never locked)
 * @param mfaSecret       Base32 TOTP secret (null when MFA is not configured)
 */
public record Account(
        String identity,
        String credentialHash,
        String role,
        Set<String> permissions,
        int failedAttempts,
        Instant lockExpiry,
        String mfaSecret) {

    public Account {
        if (identity == null || identity.isBlank()) {
            throw new IllegalArgumentException("Account identity cannot be null or blank");
        }
        if (permissions == null) {
            permissions = Set.of();
        } else {
            permissions = Set.copyOf(permissions);
        }
        if (failedAttempts < 0) {
            failedAttempts = 0;
        }
    }

    /**
     * Checks whether a lock is active at the given instant.
     */
    public boolean isLocked(Instant now) {
        return lockExpiry != null && now.isBefore(lockExpiry);
    }

    /**
     * Checks whether the account carries a lock that has already run out.
     */
    public boolean hasExpiredLock(Instant now) {
        return lockExpiry != null && !now.isBefore(lockExpiry);
    }

    public boolean mfaEnabled() {
        return mfaSecret != null && !mfaSecret.isBlank();
    }

    public Account withFailureState(int failedAttempts, Instant lockExpiry) {
        return new Account(identity, credentialHash, role, permissions, failedAttempts, lockExpiry, mfaSecret);
    }

    /**
     * Normalise an identity for lookups and keyspaces.
     *
     * @param identity raw identity as submitted
     * @return trimmed lower-case identity, or null if the input is null
     */
    public static String normalize(String identity) {
        return identity == null ? null : identity.trim().toLowerCase(Locale.ROOT);
    }
}
