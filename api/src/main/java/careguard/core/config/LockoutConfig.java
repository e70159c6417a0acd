package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for per-account lockout.
 *
 * <p>Configuration prefix: {@code careguard.auth.lockout}
 */
@ConfigMapping(prefix = "careguard.auth.lockout")
public interface LockoutConfig {

    /**
     * Consecutive failed verifications that lock the account.
     *
     * @return max failures (default: 5)
     */
    @WithDefault("5")
    int maxFailedAttempts();

    /**
     * Fixed lock duration measured from the locking failure.
     *
     * @return lock duration (default: 30 minutes)
     */
    @WithDefault("PT30M")
    Duration lockDuration();
}
