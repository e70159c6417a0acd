package careguard.core.service.compliance;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;

import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.ComplianceConfig;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.compliance.AuditHistory;
import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.port.out.AlertPublishing;
import careguard.core.port.out.AuditEventRepository;
import careguard.core.port.out.OriginHistoryRepository;
import careguard.core.port.out.ViolationRepository;
import careguard.core.service.compliance.rules.AfterHoursAccessRule;
import careguard.core.service.compliance.rules.BulkDataAccessRule;
import careguard.core.service.compliance.rules.ExcessiveFailedLoginsRule;
import careguard.core.service.compliance.rules.SuspiciousAccessPatternRule;

/**
 * Classifies recorded audit events into compliance violations.
 *
 * <p>For each event the analyzer loads the identity's recent history, runs
 * every {@link ComplianceRule} independently, and stores each finding with
 * status {@code OPEN}. HIGH and CRITICAL findings are published as alerts.
 *
 * <p>Analysis tolerates duplicate delivery. A violation id is derived from the
 * triggering event and the violation type, so a redelivered event cannot store
 * a second copy. The same type is also not raised again for the same identity
 * within the suppression window, so one burst of activity yields one finding.
 *
 * <p>The event's origin is added to the identity's origin history only after
 * the rules have run.
 */
@ApplicationScoped
public class ComplianceAnalyzer {

    private static final Logger LOG = Logger.getLogger(ComplianceAnalyzer.class);

    private final ComplianceConfig config;
    private final AuditEventRepository auditRepository;
    private final OriginHistoryRepository originRepository;
    private final ViolationRepository violationRepository;
    private final AlertPublishing alerts;
    private final List<ComplianceRule> rules;
    private final Duration lookback;

    @Inject
    public ComplianceAnalyzer(
            ComplianceConfig config,
            AuditEventRepository auditRepository,
            OriginHistoryRepository originRepository,
            ViolationRepository violationRepository,
            AlertPublishing alerts) {
        this(
                config,
                auditRepository,
                originRepository,
                violationRepository,
                alerts,
                List.of(
                        new ExcessiveFailedLoginsRule(config),
                        new AfterHoursAccessRule(config),
                        new BulkDataAccessRule(config),
                        new SuspiciousAccessPatternRule(config)));
    }

    public ComplianceAnalyzer(
            ComplianceConfig config,
            AuditEventRepository auditRepository,
            OriginHistoryRepository originRepository,
            ViolationRepository violationRepository,
            AlertPublishing alerts,
            List<ComplianceRule> rules) {
        this.config = config;
        this.auditRepository = auditRepository;
        this.originRepository = originRepository;
        this.violationRepository = violationRepository;
        this.alerts = alerts;
        this.rules = List.copyOf(rules);
        this.lookback = Stream.of(
                        config.failedLoginWindow(), config.bulkAccessWindow(), config.rapidActivityWindow())
                .max(Duration::compareTo)
                .orElse(Duration.ofHours(1));
    }

    /**
     * Analyse one recorded event.
     *
     * @param event event as persisted (timestamp set)
     * @return violations newly stored for this event
     */
    public Uni<List<ComplianceViolation>> analyze(AuditEvent event) {
        if (!config.enabled() || event.timestamp() == null) {
            return Uni.createFrom().item(List.of());
        }

        return loadHistory(event)
                .flatMap(history -> Multi.createFrom()
                        .iterable(rules)
                        .onItem()
                        .transformToUniAndConcatenate(rule -> evaluate(rule, event, history))
                        .collect()
                        .asList())
                .map(results -> results.stream().flatMap(List::stream).toList())
                .call(() -> rememberOrigin(event));
    }

    private Uni<List<ComplianceViolation>> evaluate(ComplianceRule rule, AuditEvent event, AuditHistory history) {
        final var finding = rule.evaluate(event, history);
        if (finding.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var violation = finding.get();
        return isSuppressed(violation).flatMap(suppressed -> {
            if (suppressed) {
                LOG.debugf(
                        "Suppressed %s for %s: already raised within %s",
                        violation.type(), violation.identity(), config.suppressionWindow());
                return Uni.createFrom().item(List.<ComplianceViolation>of());
            }
            return violationRepository.saveIfAbsent(violation).map(saved -> {
                if (!saved) {
                    LOG.debugf("Violation %s already recorded, ignoring duplicate", violation.id());
                    return List.<ComplianceViolation>of();
                }
                LOG.infof(
                        "Compliance violation %s (%s) for %s: %s",
                        violation.type(), violation.severity(), violation.identity(), violation.description());
                if (violation.severity().requiresAlert()) {
                    alerts.publish(violation);
                }
                return List.of(violation);
            });
        });
    }

    private Uni<Boolean> isSuppressed(ComplianceViolation violation) {
        if (violation.identity() == null || config.suppressionWindow().isZero()) {
            return Uni.createFrom().item(false);
        }
        return violationRepository.existsSince(
                violation.identity(), violation.type(), violation.timestamp().minus(config.suppressionWindow()));
    }

    private Uni<AuditHistory> loadHistory(AuditEvent event) {
        if (event.identity() == null) {
            return Uni.createFrom().item(new AuditHistory(List.of(event), Set.of()));
        }
        final var at = event.timestamp();
        final Uni<List<AuditEvent>> recent = auditRepository.findByIdentitySince(event.identity(), at.minus(lookback));
        final Uni<Set<String>> origins =
                originRepository.findOrigins(event.identity(), at.minus(config.originHistory()));
        return Uni.combine().all().unis(recent, origins).asTuple().map(tuple -> {
            final var events = new ArrayList<>(tuple.getItem1());
            if (events.stream().noneMatch(e -> e.id().equals(event.id()))) {
                events.add(event);
            }
            return new AuditHistory(events, tuple.getItem2());
        });
    }

    private Uni<Void> rememberOrigin(AuditEvent event) {
        if (event.identity() == null || !ClientInfo.isKnownOrigin(event.originAddress())) {
            return Uni.createFrom().voidItem();
        }
        return originRepository.recordOrigin(event.identity(), event.originAddress(), event.timestamp());
    }
}
