package careguard.adapter.out.alert;

import org.jboss.logging.Logger;

import careguard.spi.AlertHandler;
import careguard.spi.ViolationAlert;

/**
 * Alert handler that logs to the {@code careguard.security} category.
 *
 * <p>HIGH alerts log at WARN, CRITICAL at ERROR.
 */
public class LoggingAlertHandler implements AlertHandler {

    private static final Logger LOG = Logger.getLogger("careguard.security");

    @Override
    public String name() {
        return "logging";
    }

    @Override
    public String description() {
        return "Logs compliance alerts using JBoss Logging";
    }

    @Override
    public int priority() {
        return 0;
    }

    @Override
    public void handle(ViolationAlert alert) {
        final var message = format(alert);
        switch (alert.severity()) {
            case CRITICAL -> LOG.error(message);
            case HIGH -> LOG.warn(message);
            default -> LOG.info(message);
        }
    }

    static String format(ViolationAlert alert) {
        return String.format(
                "COMPLIANCE_ALERT: type=%s severity=%s identity=%s resource=%s at=%s violation=%s description=\"%s\""
                        + " remediation=\"%s\"",
                alert.violationType(),
                alert.severity(),
                alert.identity(),
                alert.resourceId(),
                alert.timestamp(),
                alert.violationId(),
                alert.description(),
                alert.remediation());
    }
}
