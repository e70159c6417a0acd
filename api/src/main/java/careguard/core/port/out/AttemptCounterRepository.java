package careguard.core.port.out;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.smallrye.mutiny.Uni;

import careguard.core.model.auth.AttemptCounter;

/**
 * Storage for fixed-window attempt counters.
 *
 * <h2>Implementation Requirements</h2>
 * <ul>
 *   <li>{@link #incrementIfBelow} MUST read and increment in one atomic step</li>
 *   <li>Counters MUST expire once their window has elapsed</li>
 *   <li>Only single-key operations are used</li>
 * </ul>
 *
 * <p>Keys carry a keyspace prefix, e.g. {@code identity:a@x.com} or
 * {@code origin:10.0.0.7}.
 */
public interface AttemptCounterRepository {

    /**
     * Count one attempt unless the key has already reached its threshold.
     *
     * <p>If the stored window has elapsed it is discarded and a new window is
     * anchored at {@code now}.
     *
     * @param key       keyspace-prefixed key
     * @param threshold attempts allowed per window
     * @param window    window length
     * @param now       current time
     * @return whether the attempt was counted, with the counter state afterwards
     */
    Uni<CounterResult> incrementIfBelow(String key, int threshold, Duration window, Instant now);

    /**
     * Read a counter without changing it.
     *
     * @return the live counter, or empty if none exists or it has expired
     */
    Uni<Optional<AttemptCounter>> find(String key, Duration window, Instant now);

    /**
     * Discard a counter.
     */
    Uni<Void> reset(String key);

    /**
     * Result of {@link #incrementIfBelow}.
     *
     * @param permitted true if the attempt was counted
     * @param counter   counter state after the call
     */
    record CounterResult(boolean permitted, AttemptCounter counter) {}
}
