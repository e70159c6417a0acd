package careguard.core.port.out;

import java.time.Instant;
import java.util.Set;

import io.smallrye.mutiny.Uni;

/**
 * Network origins observed per identity, each with its last-seen time.
 */
public interface OriginHistoryRepository {

    /**
     * Origins last seen at or after {@code since}.
     */
    Uni<Set<String>> findOrigins(String identity, Instant since);

    /**
     * Record that an origin was seen. Later sightings move the last-seen time forward.
     */
    Uni<Void> recordOrigin(String identity, String origin, Instant seenAt);
}
