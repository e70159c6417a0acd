package careguard.spi;

/**
 * SPI for delivering compliance alerts to a notification channel.
 *
 * <p>Implementations are discovered via {@link java.util.ServiceLoader}. Only
 * HIGH and CRITICAL violations reach handlers. Delivery guarantees (retries,
 * at-least-once) belong to the channel behind the handler.
 *
 * <p>Built-in handlers:
 * <ul>
 *   <li>{@code logging} - Logs alerts to the {@code careguard.security} category (priority 0)</li>
 *   <li>{@code metrics} - Counts alerts as Micrometer metrics (priority 10)</li>
 * </ul>
 *
 * <p>Example implementation:
 * <pre>{@code
 * public class PagerAlertHandler implements AlertHandler {
 *     @Override
 *     public String name() { return "pager"; }
 *
 *     @Override
 *     public int priority() { return 100; }
 *
 *     @Override
 *     public void handle(ViolationAlert alert) {
 *         pagerClient.trigger(alert.violationType().name(), alert.description());
 *     }
 * }
 * }</pre>
 *
 * <p>Register implementations in:
 * {@code META-INF/services/careguard.spi.AlertHandler}
 */
public interface AlertHandler {

    /**
     * Returns the unique name of this handler.
     *
     * @return handler name (e.g., "pager", "email", "webhook")
     */
    String name();

    default String description() {
        return name() + " alert handler";
    }

    /**
     * Returns the priority of this handler. Higher priority handlers are invoked first.
     *
     * @return priority value (higher = invoked first)
     */
    default int priority() {
        return 0;
    }

    /**
     * Returns whether this handler is configured and should receive alerts.
     */
    default boolean isAvailable() {
        return true;
    }

    /**
     * Deliver an alert.
     *
     * <p>Exceptions are caught and logged by the dispatcher so one failing
     * handler does not stop the others.
     *
     * @param alert the alert
     */
    void handle(ViolationAlert alert);

    /**
     * Called during shutdown to release any resources.
     */
    default void close() {}
}
