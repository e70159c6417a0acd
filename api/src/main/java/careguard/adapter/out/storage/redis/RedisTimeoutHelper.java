package careguard.adapter.out.storage.redis;

import java.time.Duration;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.port.out.StoreUnavailableException;

/**
 * Applies the storage timeout to Redis operations and converts timeouts and
 * failures into {@link StoreUnavailableException}.
 *
 * <p>Every store call in this service fails closed, so there is a single mode:
 * an operation that does not answer within the timeout, or that fails, fails
 * the caller. Whether the caller then denies (rate limit, lockout) or carries
 * on (audit) is decided in the core.
 *
 * <h2>Metrics</h2>
 * Records separate counters for timeouts ({@code careguard.redis.timeouts.total})
 * and other failures ({@code careguard.redis.failures.total}).
 */
public class RedisTimeoutHelper {

    private static final Logger LOG = Logger.getLogger(RedisTimeoutHelper.class);

    private final Duration timeout;
    private final MeterRegistry meterRegistry;
    private final String repositoryName;

    /**
     * Create a new timeout helper.
     *
     * @param timeout        the timeout for Redis operations
     * @param meterRegistry  registry for timeout/failure counters (may be null)
     * @param repositoryName repository name for logging and metric tags
     */
    public RedisTimeoutHelper(Duration timeout, MeterRegistry meterRegistry, String repositoryName) {
        this.timeout = timeout;
        this.meterRegistry = meterRegistry;
        this.repositoryName = repositoryName;
    }

    /**
     * Bound an operation by the timeout.
     *
     * @param operation     the Redis operation
     * @param operationName name for logging and metrics
     * @param <T>           the result type
     * @return a Uni that fails with {@link StoreUnavailableException} on timeout or failure
     */
    public <T> Uni<T> withTimeout(Uni<T> operation, String operationName) {
        return operation
                .ifNoItem()
                .after(timeout)
                .failWith(() -> {
                    LOG.warnv("Redis operation timeout: {0} in {1} after {2}", operationName, repositoryName, timeout);
                    record("careguard.redis.timeouts.total", operationName);
                    return new StoreUnavailableException(repositoryName, operationName);
                })
                .onFailure(error -> !(error instanceof StoreUnavailableException))
                .transform(error -> {
                    LOG.warnv(
                            "Redis operation failure: {0} in {1}: {2}",
                            operationName, repositoryName, error.getMessage());
                    record("careguard.redis.failures.total", operationName);
                    return new StoreUnavailableException(repositoryName, operationName, error);
                });
    }

    private void record(String metric, String operationName) {
        if (meterRegistry != null) {
            Counter.builder(metric)
                    .tag("repository", repositoryName)
                    .tag("operation", operationName)
                    .register(meterRegistry)
                    .increment();
        }
    }
}
