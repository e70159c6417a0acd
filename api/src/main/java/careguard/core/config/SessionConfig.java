package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for sessions and bearer tokens.
 *
 * <p>Configuration prefix: {@code careguard.session}
 */
@ConfigMapping(prefix = "careguard.session")
public interface SessionConfig {

    /**
     * Absolute session lifetime. Sessions are never extended.
     *
     * @return session duration (default: 8 hours)
     */
    @WithDefault("PT8H")
    Duration ttl();

    /**
     * ID generation configuration.
     */
    IdGenerationConfig idGeneration();

    /**
     * Bearer token configuration.
     */
    TokenConfig token();

    interface IdGenerationConfig {

        /**
         * Attempts to find an unused session id before giving up.
         *
         * @return max retries (default: 3)
         */
        @WithDefault("3")
        int maxRetries();
    }

    interface TokenConfig {

        /**
         * Token issuer ({@code iss} claim).
         *
         * @return issuer (default: careguard)
         */
        @WithDefault("careguard")
        String issuer();

        /**
         * HMAC-SHA256 signing secret. Must be at least 32 bytes. Provisioned by
         * the external key-management service.
         *
         * @return signing secret
         */
        String signingSecret();

        /**
         * Allowed clock skew when checking token expiry.
         *
         * @return skew (default: 30 seconds)
         */
        @WithDefault("PT30S")
        Duration clockSkew();
    }
}
