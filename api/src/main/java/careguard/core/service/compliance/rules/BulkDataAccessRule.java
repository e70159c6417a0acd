package careguard.core.service.compliance.rules;

import java.util.Optional;

import careguard.core.config.ComplianceConfig;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.compliance.AuditHistory;
import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationSeverity;
import careguard.core.model.compliance.ViolationType;
import careguard.core.service.compliance.ComplianceRule;

/**
 * Raises HIGH when an identity's data access events exceed the bulk threshold
 * inside the trailing window.
 */
public class BulkDataAccessRule implements ComplianceRule {

    private final ComplianceConfig config;

    public BulkDataAccessRule(ComplianceConfig config) {
        this.config = config;
    }

    @Override
    public ViolationType type() {
        return ViolationType.BULK_DATA_ACCESS;
    }

    @Override
    public Optional<ComplianceViolation> evaluate(AuditEvent event, AuditHistory history) {
        if (event.type() != AuditEventType.DATA_ACCESS || event.identity() == null) {
            return Optional.empty();
        }
        final var accesses = history.countWithin(
                event.timestamp(), config.bulkAccessWindow(), e -> e.type() == AuditEventType.DATA_ACCESS);
        if (accesses <= config.bulkAccessThreshold()) {
            return Optional.empty();
        }
        return Optional.of(ComplianceViolation.open(
                type(),
                ViolationSeverity.HIGH,
                String.format(
                        "%d data access events by %s within %s", accesses, event.identity(), config.bulkAccessWindow()),
                event.identity(),
                event.resourceId(),
                event.timestamp(),
                event.id()));
    }
}
