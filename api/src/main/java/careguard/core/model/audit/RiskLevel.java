package careguard.core.model.audit;

/**
 * Risk assigned to an audit event when it is recorded.
 */
public enum RiskLevel {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL
}
