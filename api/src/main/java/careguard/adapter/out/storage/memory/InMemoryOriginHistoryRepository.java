package careguard.adapter.out.storage.memory;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

import io.smallrye.mutiny.Uni;

import careguard.core.port.out.OriginHistoryRepository;

/**
 * In-memory origin history for development and tests.
 */
public class InMemoryOriginHistoryRepository implements OriginHistoryRepository {

    private final ConcurrentMap<String, ConcurrentMap<String, Instant>> origins = new ConcurrentHashMap<>();

    @Override
    public Uni<Set<String>> findOrigins(String identity, Instant since) {
        return Uni.createFrom().item(() -> {
            final var seen = origins.get(identity);
            if (seen == null) {
                return Set.<String>of();
            }
            return seen.entrySet().stream()
                    .filter(e -> !e.getValue().isBefore(since))
                    .map(Map.Entry::getKey)
                    .collect(Collectors.toUnmodifiableSet());
        });
    }

    @Override
    public Uni<Void> recordOrigin(String identity, String origin, Instant seenAt) {
        return Uni.createFrom().item(() -> {
            origins.computeIfAbsent(identity, k -> new ConcurrentHashMap<>())
                    .merge(origin, seenAt, (existing, incoming) -> incoming.isAfter(existing) ? incoming : existing);
            return null;
        });
    }
}
