package careguard.core.port.in;

import java.util.Optional;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationStatus;

/**
 * Inbound port for reviewing compliance violations.
 */
public interface ViolationManagement {

    Multi<ComplianceViolation> listByStatus(ViolationStatus status);

    Uni<Optional<ComplianceViolation>> find(String id);

    /**
     * Move a violation forward in its review lifecycle.
     *
     * @param id     violation id
     * @param status target status
     * @return the updated violation, or empty if not found
     * @throws IllegalStateException (as Uni failure) for backward transitions
     */
    Uni<Optional<ComplianceViolation>> transition(String id, ViolationStatus status);
}
