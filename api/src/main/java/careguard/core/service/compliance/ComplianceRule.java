package careguard.core.service.compliance;

import java.util.Optional;

import careguard.core.model.audit.AuditEvent;
import careguard.core.model.compliance.AuditHistory;
import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationType;

/**
 * A single compliance rule.
 *
 * <p>Rules are pure functions of the event and the identity's recent history.
 * They do not depend on each other or on evaluation order, and several may
 * fire for the same event.
 */
public interface ComplianceRule {

    /**
     * The violation type this rule raises.
     */
    ViolationType type();

    /**
     * Evaluate the rule.
     *
     * @param event   event under analysis
     * @param history recent events (including {@code event}) and known origins
     *                (excluding {@code event}'s origin unless seen before)
     * @return a violation, or empty if the rule does not fire
     */
    Optional<ComplianceViolation> evaluate(AuditEvent event, AuditHistory history);
}
