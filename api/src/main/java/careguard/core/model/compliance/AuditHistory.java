package careguard.core.model.compliance;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

import careguard.core.model.audit.AuditEvent;

/**
 * Bounded view of an identity's recent audit trail used by compliance rules.
 *
 * @param recentEvents  events for the identity in the analyzer's lookback window,
 *                      including the event under analysis
 * @param knownOrigins  origins seen for the identity over the origin history window,
 *                      excluding the event under analysis
 */
public record AuditHistory(List<AuditEvent> recentEvents, Set<String> knownOrigins) {

    public AuditHistory {
        recentEvents = recentEvents == null ? List.of() : List.copyOf(recentEvents);
        knownOrigins = knownOrigins == null ? Set.of() : Set.copyOf(knownOrigins);
    }

    /**
     * Count events inside {@code (at - window, at]} that match the filter.
     */
    public long countWithin(Instant at, Duration window, Predicate<AuditEvent> filter) {
        final var from = at.minus(window);
        return recentEvents.stream()
                .filter(e -> e.timestamp() != null)
                .filter(e -> e.timestamp().isAfter(from) && !e.timestamp().isAfter(at))
                .filter(filter)
                .count();
    }
}
