package careguard.adapter.out.compliance;

import java.time.Duration;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;

import jakarta.annotation.PreDestroy;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import org.jboss.logging.Logger;

import careguard.core.config.AuditConfig;
import careguard.core.model.audit.AuditEvent;
import careguard.core.port.out.ComplianceEventQueue;
import careguard.core.service.compliance.ComplianceAnalyzer;

/**
 * Hands recorded audit events to the compliance analyzer on a dedicated thread.
 *
 * <p>The queue is bounded by {@code careguard.audit.queue-capacity}. When it is
 * full the event is rejected and the caller logs it; the request path never
 * waits for analysis.
 */
@ApplicationScoped
public class ComplianceEventPipeline implements ComplianceEventQueue {

    private static final Logger LOG = Logger.getLogger(ComplianceEventPipeline.class);

    private static final Duration ANALYSIS_TIMEOUT = Duration.ofSeconds(30);

    private final ComplianceAnalyzer analyzer;
    private final Executor executor;

    @Inject
    public ComplianceEventPipeline(ComplianceAnalyzer analyzer, AuditConfig config) {
        this(analyzer, new ThreadPoolExecutor(
                1,
                1,
                0L,
                TimeUnit.MILLISECONDS,
                new ArrayBlockingQueue<>(config.queueCapacity()),
                r -> {
                    final var thread = new Thread(r, "compliance-analyzer");
                    thread.setDaemon(true);
                    return thread;
                }));
    }

    ComplianceEventPipeline(ComplianceAnalyzer analyzer, Executor executor) {
        this.analyzer = analyzer;
        this.executor = executor;
    }

    @Override
    public boolean enqueue(AuditEvent event) {
        try {
            executor.execute(() -> analyze(event));
            return true;
        } catch (RejectedExecutionException e) {
            LOG.warnf("Compliance queue full, dropping analysis of event %s", event.id());
            return false;
        }
    }

    private void analyze(AuditEvent event) {
        try {
            final var violations = analyzer.analyze(event).await().atMost(ANALYSIS_TIMEOUT);
            if (!violations.isEmpty()) {
                LOG.debugf("Event %s produced %d violation(s)", event.id(), violations.size());
            }
        } catch (Exception e) {
            LOG.errorf(e, "Compliance analysis failed for event %s", event.id());
        }
    }

    @PreDestroy
    void shutdown() {
        if (executor instanceof ExecutorService service) {
            service.shutdown();
            try {
                if (!service.awaitTermination(5, TimeUnit.SECONDS)) {
                    service.shutdownNow();
                }
            } catch (InterruptedException e) {
                service.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }
}
