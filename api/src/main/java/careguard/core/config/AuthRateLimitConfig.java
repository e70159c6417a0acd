package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for login rate limiting.
 *
 * <p>Configuration prefix: {@code careguard.auth.rate-limit}
 *
 * <p>Attempts are counted in two independent keyspaces: by identity and by
 * network origin. The origin threshold is a multiple of the identity threshold
 * so a single address spraying many identities is bounded separately from
 * per-account lockout.
 *
 * @see careguard.core.service.auth.AuthRateLimitService
 */
@ConfigMapping(prefix = "careguard.auth.rate-limit")
public interface AuthRateLimitConfig {

    /**
     * Enable login rate limiting.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Maximum attempts per identity within one window.
     *
     * @return max attempts (default: 5)
     */
    @WithDefault("5")
    int maxAttemptsPerIdentity();

    /**
     * Multiplier applied to the identity threshold for the origin keyspace.
     *
     * @return multiplier (default: 3, i.e. 15 attempts per origin)
     */
    @WithDefault("3")
    int originMultiplier();

    /**
     * Window length. Counters reset once the window anchored at the first
     * attempt has elapsed.
     *
     * @return window duration (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration window();

    default int maxAttemptsPerOrigin() {
        return maxAttemptsPerIdentity() * originMultiplier();
    }
}
