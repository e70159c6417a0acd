package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the second authentication factor.
 *
 * <p>Configuration prefix: {@code careguard.auth.mfa}
 */
@ConfigMapping(prefix = "careguard.auth.mfa")
public interface MfaConfig {

    /**
     * Lifetime of the challenge token handed out after password verification.
     *
     * @return challenge TTL (default: 5 minutes)
     */
    @WithDefault("PT5M")
    Duration challengeTtl();

    /**
     * Number of digits in a TOTP code.
     *
     * @return digits (default: 6)
     */
    @WithDefault("6")
    int codeDigits();

    /**
     * TOTP time step.
     *
     * @return step (default: 30 seconds)
     */
    @WithDefault("PT30S")
    Duration timeStep();

    /**
     * Number of steps before and after the current one that are accepted.
     *
     * @return drift steps (default: 1)
     */
    @WithDefault("1")
    int allowedDriftSteps();
}
