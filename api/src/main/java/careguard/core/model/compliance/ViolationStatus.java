package careguard.core.model.compliance;

/**
 * Review lifecycle of a violation. Transitions only move forward.
 */
public enum ViolationStatus {
    OPEN,
    REVIEWED,
    CLOSED;

    public boolean canTransitionTo(ViolationStatus next) {
        return next != null && next.ordinal() > ordinal();
    }
}
