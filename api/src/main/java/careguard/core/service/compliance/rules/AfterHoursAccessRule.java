package careguard.core.service.compliance.rules;

import java.time.DayOfWeek;
import java.time.ZoneId;
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
 * Raises MEDIUM for data access or authentication before business hours start,
 * after they end, or on a weekend, in the configured time zone.
 */
public class AfterHoursAccessRule implements ComplianceRule {

    private final ComplianceConfig config;
    private final ZoneId zone;

    public AfterHoursAccessRule(ComplianceConfig config) {
        this.config = config;
        this.zone = ZoneId.of(config.timeZone());
    }

    @Override
    public ViolationType type() {
        return ViolationType.AFTER_HOURS_ACCESS;
    }

    @Override
    public Optional<ComplianceViolation> evaluate(AuditEvent event, AuditHistory history) {
        if (event.type() != AuditEventType.DATA_ACCESS && event.type() != AuditEventType.AUTHENTICATION) {
            return Optional.empty();
        }
        final var local = event.timestamp().atZone(zone);
        final var day = local.getDayOfWeek();
        final var time = local.toLocalTime();
        final var weekend = day == DayOfWeek.SATURDAY || day == DayOfWeek.SUNDAY;
        final var outsideHours =
                time.isBefore(config.businessHoursStart()) || time.isAfter(config.businessHoursEnd());
        if (!weekend && !outsideHours) {
            return Optional.empty();
        }
        return Optional.of(ComplianceViolation.open(
                type(),
                ViolationSeverity.MEDIUM,
                String.format(
                        "%s %s by %s at %s (%s)",
                        event.type(),
                        event.action(),
                        event.identity() != null ? event.identity() : "anonymous",
                        local.toLocalDateTime(),
                        weekend ? "weekend" : "outside business hours"),
                event.identity(),
                event.resourceId(),
                event.timestamp(),
                event.id()));
    }
}
