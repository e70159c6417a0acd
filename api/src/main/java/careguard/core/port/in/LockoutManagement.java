package careguard.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import careguard.core.model.account.FailureState;

/**
 * Inbound port for administering account lockouts.
 */
public interface LockoutManagement {

    /**
     * Current failure state of an account.
     *
     * @param identity account identity
     * @return failure state, or empty if the account is unknown
     */
    Uni<Optional<FailureState>> lockoutStatus(String identity);

    /**
     * Clear the failure counter and lock of an account.
     *
     * @param identity account identity
     * @param actor    administrator performing the action
     * @return Uni completing when cleared
     */
    Uni<Void> clearLockout(String identity, String actor);
}
