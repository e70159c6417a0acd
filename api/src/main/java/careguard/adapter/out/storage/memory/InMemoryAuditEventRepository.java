package careguard.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;

import io.smallrye.mutiny.Uni;

import careguard.core.model.audit.AuditEvent;
import careguard.core.port.out.AuditEventRepository;

/**
 * In-memory audit sink for development and tests.
 *
 * <p>Events are appended per identity and never removed. Each one is stored
 * once, tagged with an append sequence number. Retention markers are kept on
 * the records but not enforced.
 */
public class InMemoryAuditEventRepository implements AuditEventRepository {

    private static final String ANONYMOUS = "";

    private final ConcurrentMap<String, ConcurrentLinkedQueue<Entry>> byIdentity = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Uni<Void> append(AuditEvent event) {
        return Uni.createFrom().item(() -> {
            byIdentity
                    .computeIfAbsent(keyFor(event.identity()), k -> new ConcurrentLinkedQueue<>())
                    .add(new Entry(sequence.incrementAndGet(), event));
            return null;
        });
    }

    @Override
    public Uni<List<AuditEvent>> findByIdentitySince(String identity, Instant since) {
        return Uni.createFrom().item(() -> {
            final var entries = byIdentity.get(keyFor(identity));
            if (entries == null) {
                return List.<AuditEvent>of();
            }
            return entries.stream()
                    .map(Entry::event)
                    .filter(e -> !e.timestamp().isBefore(since))
                    .sorted(Comparator.comparing(AuditEvent::timestamp))
                    .toList();
        });
    }

    /**
     * Every recorded event in append order (for testing).
     */
    public List<AuditEvent> snapshot() {
        return byIdentity.values().stream()
                .flatMap(ConcurrentLinkedQueue::stream)
                .sorted(Comparator.comparingLong(Entry::sequence))
                .map(Entry::event)
                .toList();
    }

    private static String keyFor(String identity) {
        return identity != null ? identity : ANONYMOUS;
    }

    private record Entry(long sequence, AuditEvent event) {}
}
