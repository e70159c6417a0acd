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
 * Raises MEDIUM when an identity reaches the failed authentication threshold
 * inside the trailing window.
 */
public class ExcessiveFailedLoginsRule implements ComplianceRule {

    private final ComplianceConfig config;

    public ExcessiveFailedLoginsRule(ComplianceConfig config) {
        this.config = config;
    }

    @Override
    public ViolationType type() {
        return ViolationType.EXCESSIVE_FAILED_LOGINS;
    }

    @Override
    public Optional<ComplianceViolation> evaluate(AuditEvent event, AuditHistory history) {
        if (!isFailedAuthentication(event) || event.identity() == null) {
            return Optional.empty();
        }
        final var failures = history.countWithin(
                event.timestamp(), config.failedLoginWindow(), ExcessiveFailedLoginsRule::isFailedAuthentication);
        if (failures < config.failedLoginThreshold()) {
            return Optional.empty();
        }
        return Optional.of(ComplianceViolation.open(
                type(),
                ViolationSeverity.MEDIUM,
                String.format(
                        "%d failed authentication attempts for %s within %s",
                        failures, event.identity(), config.failedLoginWindow()),
                event.identity(),
                event.resourceId(),
                event.timestamp(),
                event.id()));
    }

    private static boolean isFailedAuthentication(AuditEvent event) {
        return event.type() == AuditEventType.AUTHENTICATION && !event.success();
    }
}
