package careguard.core.model.auth;

import java.time.Duration;
import java.time.Instant;

/**
 * Fixed-window attempt counter for one rate-limit key.
 *
 * @param key         keyspace-prefixed key (e.g. {@code identity:a@x.com})
 * @param count       attempts recorded in the current window
 * @param windowStart first attempt of the current window
 */
public record AttemptCounter(String key, long count, Instant windowStart) {

    public Instant windowEnd(Duration window) {
        return windowStart.plus(window);
    }

    public boolean isExpired(Instant now, Duration window) {
        return !now.isBefore(windowEnd(window));
    }
}
