package careguard.adapter.in.dto;

import java.time.Instant;

import careguard.core.model.compliance.ComplianceViolation;

/**
 * Violation as exposed to reviewers.
 */
public record ViolationDto(
        String id,
        String type,
        String severity,
        String description,
        String identity,
        String resourceId,
        Instant timestamp,
        String remediation,
        String status) {

    public static ViolationDto from(ComplianceViolation violation) {
        return new ViolationDto(
                violation.id(),
                violation.type().name(),
                violation.severity().name(),
                violation.description(),
                violation.identity(),
                violation.resourceId(),
                violation.timestamp(),
                violation.remediation(),
                violation.status().name());
    }
}
