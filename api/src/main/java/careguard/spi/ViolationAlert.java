package careguard.spi;

import java.time.Instant;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationSeverity;
import careguard.core.model.compliance.ViolationType;

/**
 * Structured notification for a serious compliance violation.
 *
 * @param violationId  id of the stored violation
 * @param violationType violation type
 * @param severity     HIGH or CRITICAL
 * @param description  human-readable description
 * @param identity     identity involved (may be null)
 * @param resourceId   resource involved (may be null)
 * @param timestamp    time of the triggering event
 * @param remediation  remediation hint
 */
public record ViolationAlert(
        String violationId,
        ViolationType violationType,
        ViolationSeverity severity,
        String description,
        String identity,
        String resourceId,
        Instant timestamp,
        String remediation) {

    public static ViolationAlert from(ComplianceViolation violation) {
        return new ViolationAlert(
                violation.id(),
                violation.type(),
                violation.severity(),
                violation.description(),
                violation.identity(),
                violation.resourceId(),
                violation.timestamp(),
                violation.remediation());
    }
}
