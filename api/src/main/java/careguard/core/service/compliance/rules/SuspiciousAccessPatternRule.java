package careguard.core.service.compliance.rules;

import java.util.Optional;

import careguard.core.config.ComplianceConfig;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.compliance.AuditHistory;
import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationSeverity;
import careguard.core.model.compliance.ViolationType;
import careguard.core.service.compliance.ComplianceRule;

/**
 * Raises HIGH when an identity appears from an origin it has not used within
 * the origin history window, or when its overall activity exceeds the rapid
 * activity threshold.
 *
 * <p>The origin check only applies once the identity has some origin history,
 * so first use of a new account is not flagged.
 */
public class SuspiciousAccessPatternRule implements ComplianceRule {

    private final ComplianceConfig config;

    public SuspiciousAccessPatternRule(ComplianceConfig config) {
        this.config = config;
    }

    @Override
    public ViolationType type() {
        return ViolationType.SUSPICIOUS_ACCESS_PATTERN;
    }

    @Override
    public Optional<ComplianceViolation> evaluate(AuditEvent event, AuditHistory history) {
        if (event.identity() == null) {
            return Optional.empty();
        }
        final var origin = event.originAddress();
        final var known = history.knownOrigins();
        final var newOrigin = ClientInfo.isKnownOrigin(origin) && !known.isEmpty() && !known.contains(origin);

        final var activity = history.countWithin(event.timestamp(), config.rapidActivityWindow(), e -> true);
        final var rapid = activity > config.rapidActivityThreshold();

        if (!newOrigin && !rapid) {
            return Optional.empty();
        }

        final String description;
        if (newOrigin) {
            description = String.format(
                    "%s accessed from previously unseen origin %s (%d known in the last %s)",
                    event.identity(), origin, known.size(), config.originHistory());
        } else {
            description = String.format(
                    "%d events by %s within %s", activity, event.identity(), config.rapidActivityWindow());
        }
        return Optional.of(ComplianceViolation.open(
                type(),
                ViolationSeverity.HIGH,
                description,
                event.identity(),
                event.resourceId(),
                event.timestamp(),
                event.id()));
    }
}
