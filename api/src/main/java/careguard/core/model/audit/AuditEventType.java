package careguard.core.model.audit;

/**
 * Category of an audit event.
 */
public enum AuditEventType {
    DATA_ACCESS,
    DATA_MODIFICATION,
    AUTHENTICATION,
    AUTHORIZATION,
    SYSTEM_ACCESS
}
