package careguard.core.config;

import java.time.Duration;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for the audit trail.
 *
 * <p>Configuration prefix: {@code careguard.audit}
 */
@ConfigMapping(prefix = "careguard.audit")
public interface AuditConfig {

    /**
     * Retention period stamped on every audit record.
     *
     * @return retention (default: 2557 days, about seven years)
     */
    @WithDefault("P2557D")
    Duration retention();

    /**
     * Whether audit write failures fail the request that produced them.
     *
     * <p>When false, a failed write is logged at error level and the request
     * continues. Deployments that require durable audit before responding set
     * this to true.
     *
     * @return true to make audit writes blocking (default: false)
     */
    @WithDefault("false")
    boolean blockingWrites();

    /**
     * Capacity of the hand-off queue feeding compliance analysis.
     *
     * @return queue capacity (default: 10000)
     */
    @WithDefault("10000")
    int queueCapacity();
}
