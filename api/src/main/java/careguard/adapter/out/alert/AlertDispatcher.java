package careguard.adapter.out.alert;

import java.util.Comparator;
import java.util.List;
import java.util.ServiceLoader;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import org.jboss.logging.Logger;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.port.out.AlertPublishing;
import careguard.spi.AlertHandler;
import careguard.spi.ViolationAlert;

/**
 * Dispatches HIGH and CRITICAL violations to registered alert handlers.
 *
 * <p>Handlers are discovered via {@link ServiceLoader} and invoked in priority
 * order (highest first) on a dedicated thread, never on the caller's.
 */
@ApplicationScoped
public class AlertDispatcher implements AlertPublishing {

    private static final Logger LOG = Logger.getLogger(AlertDispatcher.class);

    private final MeterRegistry meterRegistry;

    private List<AlertHandler> handlers;
    private ExecutorService executor;

    @Inject
    public AlertDispatcher(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    AlertDispatcher(List<AlertHandler> handlers, ExecutorService executor) {
        this.meterRegistry = null;
        this.handlers = sorted(handlers);
        this.executor = executor;
    }

    @PostConstruct
    void init() {
        final var loadedHandlers = ServiceLoader.load(AlertHandler.class).stream()
                .map(ServiceLoader.Provider::get)
                .toList();

        for (var handler : loadedHandlers) {
            if (handler instanceof MetricsAlertHandler metricsHandler) {
                metricsHandler.setMeterRegistry(meterRegistry);
            }
        }

        handlers = sorted(loadedHandlers);

        if (handlers.isEmpty()) {
            LOG.warn("No alert handlers found - compliance alerts will not be delivered");
        } else {
            LOG.infof(
                    "Loaded %d alert handler(s): %s",
                    handlers.size(),
                    handlers.stream()
                            .map(h -> h.name() + "(priority=" + h.priority() + ")")
                            .toList());
        }

        executor = Executors.newSingleThreadExecutor(r -> {
            final var thread = new Thread(r, "compliance-alert-dispatcher");
            thread.setDaemon(true);
            return thread;
        });
    }

    @PreDestroy
    void shutdown() {
        if (executor != null) {
            executor.shutdown();
        }
        if (handlers != null) {
            handlers.forEach(handler -> {
                try {
                    handler.close();
                } catch (Exception e) {
                    LOG.warnf("Error closing alert handler %s: %s", handler.name(), e.getMessage());
                }
            });
        }
    }

    @Override
    public void publish(ComplianceViolation violation) {
        if (!violation.severity().requiresAlert()) {
            LOG.debugf("Not alerting %s violation %s", violation.severity(), violation.id());
            return;
        }
        if (handlers == null || handlers.isEmpty()) {
            return;
        }

        final var alert = ViolationAlert.from(violation);
        executor.submit(() -> {
            for (var handler : handlers) {
                try {
                    handler.handle(alert);
                } catch (Exception e) {
                    LOG.warnf("Alert handler %s failed for violation %s: %s",
                            handler.name(), alert.violationId(), e.getMessage());
                }
            }
        });
    }

    public List<AlertHandler> getHandlers() {
        return handlers != null ? handlers : List.of();
    }

    private static List<AlertHandler> sorted(List<AlertHandler> handlers) {
        return handlers.stream()
                .filter(AlertHandler::isAvailable)
                .sorted(Comparator.comparingInt(AlertHandler::priority).reversed())
                .toList();
    }
}
