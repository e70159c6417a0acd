package careguard.core.port.out;

import java.time.Instant;
import java.util.List;

import io.smallrye.mutiny.Uni;

import careguard.core.model.audit.AuditEvent;

/**
 * Append-only audit sink.
 *
 * <p>Records are never updated or deleted by the application. Each record
 * carries {@link AuditEvent#retainUntil()}, which implementations honour as
 * the earliest time the record may be purged.
 */
public interface AuditEventRepository {

    /**
     * Durably append an event.
     *
     * @param event event with risk level and retention marker set
     * @return Uni completing once the write is acknowledged
     */
    Uni<Void> append(AuditEvent event);

    /**
     * Events for an identity with a timestamp at or after {@code since},
     * ordered by timestamp.
     *
     * @param identity acting identity
     * @param since    inclusive lower bound
     * @return matching events
     */
    Uni<List<AuditEvent>> findByIdentitySince(String identity, Instant since);
}
