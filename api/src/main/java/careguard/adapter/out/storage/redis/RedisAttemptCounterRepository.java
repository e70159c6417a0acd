package careguard.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.auth.AttemptCounter;
import careguard.core.port.out.AttemptCounterRepository;

/**
 * Redis implementation of AttemptCounterRepository.
 *
 * <p>The check-and-increment runs as a Lua script, so concurrent attempts from
 * any number of instances can never both observe "below threshold" for the
 * last free slot. Counter keys expire when their window ends.
 */
public class RedisAttemptCounterRepository implements AttemptCounterRepository {

    private static final Logger LOG = Logger.getLogger(RedisAttemptCounterRepository.class);

    /**
     * Fixed-window check-and-increment.
     *
     * <p>Arguments:
     * <ol>
     *   <li>KEYS[1] - the counter key</li>
     *   <li>ARGV[1] - threshold</li>
     *   <li>ARGV[2] - current timestamp in milliseconds</li>
     *   <li>ARGV[3] - window length in milliseconds</li>
     * </ol>
     *
     * <p>Returns array: [permitted (0/1), count, window_start_ms]
     */
    private static final String INCREMENT_IF_BELOW_SCRIPT =
            """
            local key = KEYS[1]
            local threshold = tonumber(ARGV[1])
            local now_ms = tonumber(ARGV[2])
            local window_ms = tonumber(ARGV[3])

            local data = redis.call('HMGET', key, 'count', 'start_ms')
            local count = tonumber(data[1])
            local start_ms = tonumber(data[2])

            if count == nil or start_ms == nil or now_ms >= start_ms + window_ms then
                count = 0
                start_ms = now_ms
            end

            local permitted = 0
            if count < threshold then
                count = count + 1
                permitted = 1
                redis.call('HSET', key, 'count', count, 'start_ms', start_ms)
                redis.call('PEXPIREAT', key, start_ms + window_ms)
            end

            return {permitted, count, start_ms}
            """;

    private static final String FIELD_COUNT = "count";
    private static final String FIELD_START = "start_ms";

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAttemptCounterRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<CounterResult> incrementIfBelow(String key, int threshold, Duration window, Instant now) {
        // EVAL script numkeys key [key...] arg [arg...]
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        INCREMENT_IF_BELOW_SCRIPT,
                        "1",
                        keys.counter(key),
                        String.valueOf(threshold),
                        String.valueOf(now.toEpochMilli()),
                        String.valueOf(window.toMillis()))
                .map(RedisKeys::longs)
                .map(values -> {
                    final var counter =
                            new AttemptCounter(key, values.get(1), Instant.ofEpochMilli(values.get(2)));
                    LOG.debugf("Counter %s: count=%d permitted=%s", key, counter.count(), values.get(0) == 1L);
                    return new CounterResult(values.get(0) == 1L, counter);
                });
        return timeoutHelper.withTimeout(operation, "incrementIfBelow");
    }

    @Override
    public Uni<Optional<AttemptCounter>> find(String key, Duration window, Instant now) {
        final var operation = hashCommands.hgetall(keys.counter(key)).map(fields -> {
            if (fields == null || fields.get(FIELD_COUNT) == null || fields.get(FIELD_START) == null) {
                return Optional.<AttemptCounter>empty();
            }
            final var counter = new AttemptCounter(
                    key,
                    Long.parseLong(fields.get(FIELD_COUNT)),
                    Instant.ofEpochMilli(Long.parseLong(fields.get(FIELD_START))));
            return counter.isExpired(now, window) ? Optional.<AttemptCounter>empty() : Optional.of(counter);
        });
        return timeoutHelper.withTimeout(operation, "find");
    }

    @Override
    public Uni<Void> reset(String key) {
        return timeoutHelper.withTimeout(keyCommands.del(keys.counter(key)).replaceWithVoid(), "reset");
    }
}
