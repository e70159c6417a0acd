package careguard.core.service.audit;

import java.time.Clock;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.AuditConfig;
import careguard.core.model.account.Account;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.audit.RiskLevel;
import careguard.core.port.in.ComplianceEventRecording;
import careguard.core.port.out.AuditEventRepository;
import careguard.core.port.out.ComplianceEventQueue;
import careguard.core.port.out.StoreUnavailableException;

/**
 * Append-only audit trail writer.
 *
 * <p>Every event gets a timestamp (if the caller did not set one), a risk
 * level and a retention marker before it is appended. Once the sink
 * acknowledges the write, the event is handed to compliance analysis through
 * {@link ComplianceEventQueue}; analysis never runs on the caller's thread.
 *
 * <p>Write failures are logged at error level. They fail the caller only when
 * {@code careguard.audit.blocking-writes} is set.
 */
@ApplicationScoped
public class AuditLogger implements ComplianceEventRecording {

    private static final Logger LOG = Logger.getLogger(AuditLogger.class);

    private final AuditConfig config;
    private final AuditEventRepository repository;
    private final ComplianceEventQueue queue;
    private final Clock clock;

    public AuditLogger(
            AuditConfig config, AuditEventRepository repository, ComplianceEventQueue queue, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.queue = queue;
        this.clock = clock;
    }

    /**
     * Record an event.
     *
     * @param event event to record
     * @return Uni completing after the write; fails with
     *         {@link StoreUnavailableException} only in blocking mode
     */
    public Uni<Void> record(AuditEvent event) {
        final var prepared = prepare(event);
        return repository
                .append(prepared)
                .invoke(() -> handOff(prepared))
                .onFailure()
                .recoverWithUni(error -> {
                    LOG.errorf(
                            error,
                            "Audit write failed for event %s (%s %s)",
                            prepared.id(),
                            prepared.type(),
                            prepared.action());
                    if (config.blockingWrites()) {
                        return Uni.createFrom().failure(asStoreFailure(error));
                    }
                    return Uni.createFrom().voidItem();
                });
    }

    @Override
    public Uni<Void> recordComplianceEvent(AuditEvent event) {
        return record(event);
    }

    AuditEvent prepare(AuditEvent event) {
        var prepared = event;
        if (prepared.identity() != null) {
            final var identity = Account.normalize(prepared.identity());
            prepared = prepared.withIdentity(identity.isEmpty() ? null : identity);
        }
        if (prepared.timestamp() == null) {
            prepared = prepared.withTimestamp(clock.instant());
        }
        if (prepared.riskLevel() == null) {
            prepared = prepared.withRiskLevel(assessRisk(prepared));
        }
        return prepared.withRetainUntil(prepared.timestamp().plus(config.retention()));
    }

    private void handOff(AuditEvent event) {
        if (!queue.enqueue(event)) {
            LOG.warnf("Compliance queue rejected audit event %s, it will not be analysed", event.id());
        }
    }

    /**
     * Risk level for an event that arrived without one.
     */
    static RiskLevel assessRisk(AuditEvent event) {
        if (event.type() == AuditEventType.AUTHENTICATION) {
            if (AuditActions.ACCOUNT_LOCKED.equals(event.action()) || isLockingFailure(event.metadata())) {
                return RiskLevel.HIGH;
            }
            return event.success() ? RiskLevel.LOW : RiskLevel.MEDIUM;
        }
        if (event.type() == AuditEventType.AUTHORIZATION && !event.success()) {
            return RiskLevel.MEDIUM;
        }
        if (event.type() == AuditEventType.DATA_MODIFICATION) {
            return RiskLevel.MEDIUM;
        }
        return RiskLevel.LOW;
    }

    private static boolean isLockingFailure(Map<String, Object> metadata) {
        return Boolean.TRUE.equals(metadata.get("locked"));
    }

    private static Throwable asStoreFailure(Throwable error) {
        if (error instanceof StoreUnavailableException) {
            return error;
        }
        return new StoreUnavailableException("audit-sink", "append", error);
    }
}
