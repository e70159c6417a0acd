package careguard.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import careguard.core.model.account.Account;
import careguard.core.model.account.FailureState;

/**
 * Boundary to the external user directory.
 *
 * <p>The directory owns account persistence. This core only reads accounts and
 * performs single-row updates of their failure state. No operation spans more
 * than one account.
 */
public interface CredentialStore {

    /**
     * Look up an account.
     *
     * @param identity normalised identity
     * @return the account, or empty if unknown
     */
    Uni<Optional<Account>> findByIdentity(String identity);

    /**
     * Overwrite the failure state of an account.
     *
     * @param identity       normalised identity
     * @param failedAttempts consecutive failure count
     * @param lockExpiry     lock end, or null to leave the account unlocked
     * @return Uni completing when written
     */
    Uni<Void> updateFailureState(String identity, int failedAttempts, Instant lockExpiry);

    /**
     * Reset the failure counter and clear any lock.
     *
     * @param identity normalised identity
     * @return Uni completing when written
     */
    Uni<Void> resetFailureState(String identity);

    /**
     * Reset the failure counter and clear any lock, but only if the stored
     * failure state still equals the one the caller read.
     *
     * <p>The comparison and the write MUST be a single indivisible operation on
     * the account row. A failure recorded after the caller's read, including one
     * that locked the account, makes the reset a no-op.
     *
     * @param identity               normalised identity
     * @param expectedFailedAttempts failure count the caller read
     * @param expectedLockExpiry     lock end the caller read, or null
     * @return true if the state matched and was reset, false otherwise
     */
    Uni<Boolean> resetFailureStateIfUnchanged(String identity, int expectedFailedAttempts, Instant expectedLockExpiry);

    /**
     * Atomically record one failed verification.
     *
     * <p>Increments the failure counter and, when it reaches {@code maxFailures},
     * sets the lock expiry to {@code now + lockDuration}. The read and the write
     * MUST be a single indivisible operation on the account row so that
     * concurrent failures are never lost.
     *
     * @param identity     normalised identity
     * @param maxFailures  failures that lock the account
     * @param lockDuration lock length
     * @param now          current time
     * @return the failure state after the update
     */
    Uni<FailureState> recordFailure(String identity, int maxFailures, Duration lockDuration, Instant now);
}
