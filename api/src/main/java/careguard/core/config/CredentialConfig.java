package careguard.core.config;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for credential hashing.
 *
 * <p>Configuration prefix: {@code careguard.auth.credentials}
 */
@ConfigMapping(prefix = "careguard.auth.credentials")
public interface CredentialConfig {

    /**
     * bcrypt cost factor (log2 rounds) used for new hashes and for the
     * placeholder hash checked against unknown identities.
     *
     * @return cost factor (default: 12)
     */
    @WithDefault("12")
    int bcryptCost();
}
