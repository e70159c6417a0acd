package careguard.core.config;

import java.time.Duration;
import java.time.LocalTime;

import io.smallrye.config.ConfigMapping;
import io.smallrye.config.WithDefault;

/**
 * Configuration mapping for compliance rules.
 *
 * <p>Configuration prefix: {@code careguard.compliance}
 *
 * <p>Rules are threshold based so every finding can be explained by the
 * numbers below.
 */
@ConfigMapping(prefix = "careguard.compliance")
public interface ComplianceConfig {

    /**
     * Enable compliance analysis of the audit stream.
     *
     * @return true if enabled (default: true)
     */
    @WithDefault("true")
    boolean enabled();

    /**
     * Failed authentications per identity that raise a finding.
     *
     * @return threshold (default: 5)
     */
    @WithDefault("5")
    int failedLoginThreshold();

    /**
     * Window for counting failed authentications.
     *
     * @return window (default: 1 hour)
     */
    @WithDefault("PT1H")
    Duration failedLoginWindow();

    /**
     * Data access events per identity above which access counts as bulk.
     *
     * @return threshold (default: 100)
     */
    @WithDefault("100")
    int bulkAccessThreshold();

    /**
     * Window for counting data access events.
     *
     * @return window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration bulkAccessWindow();

    /**
     * Events per identity above which activity counts as suspicious.
     *
     * @return threshold (default: 50)
     */
    @WithDefault("50")
    int rapidActivityThreshold();

    /**
     * Window for counting activity.
     *
     * @return window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration rapidActivityWindow();

    /**
     * How far back origins are remembered for an identity.
     *
     * @return origin history (default: 30 days)
     */
    @WithDefault("P30D")
    Duration originHistory();

    /**
     * Start of business hours in the configured time zone.
     *
     * @return start (default: 07:00)
     */
    @WithDefault("07:00")
    LocalTime businessHoursStart();

    /**
     * End of business hours in the configured time zone.
     *
     * @return end (default: 19:00)
     */
    @WithDefault("19:00")
    LocalTime businessHoursEnd();

    /**
     * Time zone used to decide whether an event is after hours.
     *
     * @return zone id (default: UTC)
     */
    @WithDefault("UTC")
    String timeZone();

    /**
     * A finding of the same type for the same identity is not raised again
     * within this window. Zero disables suppression.
     *
     * @return suppression window (default: 15 minutes)
     */
    @WithDefault("PT15M")
    Duration suppressionWindow();
}
