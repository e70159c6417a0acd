package careguard.core.port.out;

import careguard.core.model.audit.AuditEvent;

/**
 * Hand-off from the request path to asynchronous compliance analysis.
 */
public interface ComplianceEventQueue {

    /**
     * Queue a durably recorded event for analysis. Never blocks.
     *
     * @param event the recorded event
     * @return false if the event could not be queued
     */
    boolean enqueue(AuditEvent event);
}
