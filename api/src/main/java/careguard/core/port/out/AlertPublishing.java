package careguard.core.port.out;

import careguard.core.model.compliance.ComplianceViolation;

/**
 * Outbound port for alerting on serious violations.
 *
 * <p>Implementations MUST NOT block the caller; delivery happens off the
 * calling thread.
 */
public interface AlertPublishing {

    /**
     * Publish an alert for a HIGH or CRITICAL violation. Lower severities are ignored.
     *
     * @param violation the violation
     */
    void publish(ComplianceViolation violation);
}
