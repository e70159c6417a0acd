package careguard.adapter.out.storage.memory;

import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import io.smallrye.mutiny.Uni;

import careguard.core.model.session.Session;
import careguard.core.port.out.SessionRepository;

/**
 * In-memory implementation of SessionRepository.
 *
 * <p>Suitable for development, testing, and single-instance deployments.
 * Sessions are lost on restart and not shared across instances.
 */
public class InMemorySessionRepository implements SessionRepository {

    private final ConcurrentMap<String, Session> sessions = new ConcurrentHashMap<>();

    @Override
    public Uni<Boolean> saveIfAbsent(Session session) {
        return Uni.createFrom().item(() -> sessions.putIfAbsent(session.id(), session) == null);
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        return Uni.createFrom().item(() -> Optional.ofNullable(sessions.get(sessionId)));
    }

    @Override
    public Uni<Boolean> delete(String sessionId) {
        return Uni.createFrom().item(() -> sessions.remove(sessionId) != null);
    }

    @Override
    public Uni<Integer> deleteByIdentity(String identity) {
        return Uni.createFrom().item(() -> {
            final var before = sessions.size();
            sessions.values().removeIf(session -> session.identity().equals(identity));
            return before - sessions.size();
        });
    }

    /**
     * Get the current count of sessions (for testing).
     */
    public int size() {
        return sessions.size();
    }
}
