package careguard.core.model.auth;

import java.time.Instant;

/**
 * Result of a rate limit check-and-increment.
 *
 * @param allowed   true if the attempt may proceed
 * @param key       the key that decided the outcome (null when allowed)
 * @param attempts  attempts counted in the deciding window
 * @param threshold the limit for that key
 * @param resetAt   when the deciding window ends (null when allowed)
 */
public record RateLimitDecision(boolean allowed, String key, long attempts, int threshold, Instant resetAt) {

    public static RateLimitDecision allow(long attempts, int threshold) {
        return new RateLimitDecision(true, null, attempts, threshold, null);
    }

    public static RateLimitDecision rejected(String key, long attempts, int threshold, Instant resetAt) {
        return new RateLimitDecision(false, key, attempts, threshold, resetAt);
    }

    public long retryAfterSeconds(Instant now) {
        if (allowed || resetAt == null) {
            return 0;
        }
        return Math.max(1, resetAt.getEpochSecond() - now.getEpochSecond());
    }
}
