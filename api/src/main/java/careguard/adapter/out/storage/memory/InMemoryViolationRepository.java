package careguard.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.model.compliance.ViolationType;
import careguard.core.port.out.ViolationRepository;

/**
 * In-memory violation store for development and tests.
 */
public class InMemoryViolationRepository implements ViolationRepository {

    private final ConcurrentMap<String, ComplianceViolation> violations = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(ComplianceViolation violation) {
        return Uni.createFrom().item(() -> violations.putIfAbsent(violation.id(), violation) == null);
    }

    @Override
    public Uni<Optional<ComplianceViolation>> findById(String id) {
        return Uni.createFrom().item(() -> Optional.ofNullable(violations.get(id)));
    }

    @Override
    public Uni<ComplianceViolation> update(ComplianceViolation violation) {
        return Uni.createFrom().item(() -> {
            violations.put(violation.id(), violation);
            return violation;
        });
    }

    @Override
    public Multi<ComplianceViolation> findByStatus(ViolationStatus status) {
        return Multi.createFrom().items(() -> violations.values().stream()
                .filter(v -> status == null || v.status() == status)
                .sorted(Comparator.comparing(ComplianceViolation::timestamp)));
    }

    @Override
    public Uni<Boolean> existsSince(String identity, ViolationType type, Instant since) {
        return Uni.createFrom().item(() -> violations.values().stream()
                .anyMatch(v -> identity.equals(v.identity())
                        && v.type() == type
                        && !v.timestamp().isBefore(since)));
    }

    /**
     * Number of stored violations (for testing).
     */
    public int size() {
        return violations.size();
    }
}
