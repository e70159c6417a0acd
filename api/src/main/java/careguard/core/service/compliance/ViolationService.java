package careguard.core.service.compliance;

import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.port.in.ViolationManagement;
import careguard.core.port.out.ViolationRepository;

/**
 * Review lifecycle of stored violations.
 *
 * <p>Status only moves forward: {@code OPEN -> REVIEWED -> CLOSED}, or
 * {@code OPEN -> CLOSED}.
 */
@ApplicationScoped
public class ViolationService implements ViolationManagement {

    private static final Logger LOG = Logger.getLogger(ViolationService.class);

    private final ViolationRepository repository;

    public ViolationService(ViolationRepository repository) {
        this.repository = repository;
    }

    @Override
    public Multi<ComplianceViolation> listByStatus(ViolationStatus status) {
        return repository.findByStatus(status);
    }

    @Override
    public Uni<Optional<ComplianceViolation>> find(String id) {
        return repository.findById(id);
    }

    @Override
    public Uni<Optional<ComplianceViolation>> transition(String id, ViolationStatus status) {
        return repository.findById(id).flatMap(found -> {
            if (found.isEmpty()) {
                return Uni.createFrom().item(Optional.<ComplianceViolation>empty());
            }
            final var current = found.get();
            if (!current.status().canTransitionTo(status)) {
                return Uni.createFrom()
                        .failure(new IllegalStateException(
                                "Cannot move violation from " + current.status() + " to " + status));
            }
            LOG.infof("Violation %s moved from %s to %s", id, current.status(), status);
            return repository.update(current.withStatus(status)).map(Optional::of);
        });
    }
}
