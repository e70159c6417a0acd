package careguard.core.model.account;

import java.time.Instant;

/**
 * Lockout-relevant slice of an account after a failure has been recorded.
 *
 * @param failedAttempts consecutive failures including the one just recorded
 * @param lockExpiry     lock end, or null when the account is still unlocked
 */
public record FailureState(int failedAttempts, Instant lockExpiry) {

    public boolean locked() {
        return lockExpiry != null;
    }
}
