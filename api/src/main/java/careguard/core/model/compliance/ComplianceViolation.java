package careguard.core.model.compliance;

import java.time.Instant;

/**
 * Finding derived from the audit trail.
 *
 * <p>Only the compliance analyzer creates violations. The id is derived from the
 * triggering event and the violation type so redelivered events cannot produce
 * duplicates.
 *
 * @param id            deterministic violation id
 * @param type          violation type
 * @param severity      severity
 * @param description   human-readable description
 * @param identity      identity involved (optional)
 * @param resourceId    resource involved (optional)
 * @param timestamp     timestamp of the triggering event
 * @param remediation   remediation hint
 * @param status        review status
 * @param sourceEventId id of the audit event that triggered the finding
 */
public record ComplianceViolation(
        String id,
        ViolationType type,
        ViolationSeverity severity,
        String description,
        String identity,
        String resourceId,
        Instant timestamp,
        String remediation,
        ViolationStatus status,
        String sourceEventId) {

    public ComplianceViolation {
        if (type == null) {
            throw new IllegalArgumentException("Violation type cannot be null");
        }
        if (severity == null) {
            throw new IllegalArgumentException("Violation severity cannot be null");
        }
        if (status == null) {
            status = ViolationStatus.OPEN;
        }
        if (remediation == null) {
            remediation = type.remediation();
        }
        if (id == null || id.isBlank()) {
            id = idFor(sourceEventId, type);
        }
    }

    /**
     * Create an open violation for a triggering event.
     */
    public static ComplianceViolation open(
            ViolationType type,
            ViolationSeverity severity,
            String description,
            String identity,
            String resourceId,
            Instant timestamp,
            String sourceEventId) {
        return new ComplianceViolation(
                idFor(sourceEventId, type),
                type,
                severity,
                description,
                identity,
                resourceId,
                timestamp,
                type.remediation(),
                ViolationStatus.OPEN,
                sourceEventId);
    }

    public ComplianceViolation withStatus(ViolationStatus status) {
        return new ComplianceViolation(
                id, type, severity, description, identity, resourceId, timestamp, remediation, status, sourceEventId);
    }

    public static String idFor(String sourceEventId, ViolationType type) {
        return sourceEventId + ":" + type.name();
    }
}
