package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the backing stores.
 *
 * <p>Configuration prefix: {@code careguard.storage}
 */
@ConfigMapping(prefix = "careguard.storage")
public interface StorageConfig {

    /**
     * Storage provider for counters, sessions, audit and violations.
     *
     * <p>{@code memory} keeps everything in-process and is meant for
     * development. {@code redis} is the production provider.
     *
     * @return provider name (default: memory)
     */
    @WithDefault("memory")
    String provider();

    /**
     * Upper bound for every store call. A call that exceeds it fails.
     *
     * @return timeout (default: 2 seconds)
     */
    @WithDefault("PT2S")
    Duration timeout();

    /**
     * Redis specific settings.
     */
    RedisConfig redis();

    interface RedisConfig {

        /**
         * Prefix for every key written by this service.
         *
         * @return key prefix (default: careguard:)
         */
        @WithDefault("careguard:")
        String keyPrefix();
    }
}
