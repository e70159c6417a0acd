package careguard.adapter.out.alert;

import java.util.Locale;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;

import careguard.spi.AlertHandler;
import careguard.spi.ViolationAlert;

/**
 * Alert handler that counts alerts in Micrometer.
 *
 * <p>Metric: {@code careguard.compliance.alerts.total}, tagged by violation
 * type and severity.
 */
public class MetricsAlertHandler implements AlertHandler {

    static final String METRIC = "careguard.compliance.alerts.total";

    private MeterRegistry registry;

    public MetricsAlertHandler() {
        // ServiceLoader
    }

    public MetricsAlertHandler(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Called by the dispatcher after ServiceLoader instantiation.
     */
    public void setMeterRegistry(MeterRegistry registry) {
        this.registry = registry;
    }

    @Override
    public String name() {
        return "metrics";
    }

    @Override
    public String description() {
        return "Records compliance alerts as Micrometer metrics";
    }

    @Override
    public int priority() {
        return 10;
    }

    @Override
    public boolean isAvailable() {
        return registry != null;
    }

    @Override
    public void handle(ViolationAlert alert) {
        if (registry == null) {
            return;
        }
        Counter.builder(METRIC)
                .description("Compliance violations alerted")
                .tag("type", alert.violationType().name().toLowerCase(Locale.ROOT))
                .tag("severity", alert.severity().name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
