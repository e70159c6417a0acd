package careguard.core.port.out;

import java.util.Optional;

import io.smallrye.mutiny.Uni;

import careguard.core.model.session.Session;

/**
 * Outbound port for the session registry.
 *
 * <p>Implementations store only the minimal session record. Expiry checks are
 * the service's job; implementations may additionally drop expired records.
 */
public interface SessionRepository {

    /**
     * Store a new session only if the ID does not already exist.
     *
     * <p>Implementation notes:
     * <ul>
     *   <li>Redis: SET with NX and an expiry equal to the session lifetime</li>
     *   <li>In-Memory: ConcurrentHashMap.putIfAbsent()</li>
     * </ul>
     *
     * @param session session to store
     * @return true if saved, false if the ID is taken
     */
    Uni<Boolean> saveIfAbsent(Session session);

    /**
     * Retrieve a session by ID.
     *
     * @param sessionId session identifier
     * @return the session, or empty if not found
     */
    Uni<Optional<Session>> findById(String sessionId);

    /**
     * Delete a session. Deleting a missing session is not an error.
     *
     * @param sessionId session identifier
     * @return Uni with true if a session was removed
     */
    Uni<Boolean> delete(String sessionId);

    /**
     * Delete all sessions of an identity.
     *
     * @param identity account identity
     * @return Uni with the number of sessions removed
     */
    Uni<Integer> deleteByIdentity(String identity);
}
