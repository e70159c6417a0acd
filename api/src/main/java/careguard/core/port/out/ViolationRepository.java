package careguard.core.port.out;

import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.model.compliance.ViolationType;

/**
 * Storage for compliance violations.
 */
public interface ViolationRepository {

    /**
     * Store a violation unless one with the same id exists.
     *
     * @return true if stored, false if it was a duplicate
     */
    Uni<Boolean> saveIfAbsent(ComplianceViolation violation);

    Uni<Optional<ComplianceViolation>> findById(String id);

    /**
     * Replace a stored violation (status changes only).
     */
    Uni<ComplianceViolation> update(ComplianceViolation violation);

    Multi<ComplianceViolation> findByStatus(ViolationStatus status);

    /**
     * Check whether a violation of the given type was raised for the identity
     * with a timestamp at or after {@code since}.
     */
    Uni<Boolean> existsSince(String identity, ViolationType type, Instant since);
}
