package careguard.core.model.compliance;

/**
 * Severity of a compliance violation. HIGH and CRITICAL findings are alerted.
 */
public enum ViolationSeverity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean requiresAlert() {
        return this == HIGH || this == CRITICAL;
    }
}
