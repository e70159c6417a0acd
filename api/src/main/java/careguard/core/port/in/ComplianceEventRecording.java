package careguard.core.port.in;

import io.smallrye.mutiny.Uni;

import careguard.core.model.audit.AuditEvent;

/**
 * Inbound port for services reporting data access and modification events.
 */
public interface ComplianceEventRecording {

    /**
     * Record an event in the audit trail and queue it for compliance analysis.
     *
     * @param event the event
     * @return Uni completing once recorded (or once the failure has been logged)
     */
    Uni<Void> recordComplianceEvent(AuditEvent event);
}
