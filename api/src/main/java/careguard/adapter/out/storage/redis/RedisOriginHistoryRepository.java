package careguard.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Set;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.smallrye.mutiny.Uni;

import careguard.core.port.out.OriginHistoryRepository;

/**
 * Known origins per identity, kept in a sorted set scored by last-seen time.
 */
public class RedisOriginHistoryRepository implements OriginHistoryRepository {

    private final ReactiveRedisDataSource redisDataSource;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisOriginHistoryRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Set<String>> findOrigins(String identity, Instant since) {
        final var operation = redisDataSource
                .execute("ZRANGEBYSCORE", keys.origins(identity), String.valueOf(since.toEpochMilli()), "+inf")
                .map(response -> Set.copyOf(RedisKeys.strings(response)));
        return timeoutHelper.withTimeout(operation, "findOrigins");
    }

    @Override
    public Uni<Void> recordOrigin(String identity, String origin, Instant seenAt) {
        // GT keeps the latest sighting when updates arrive out of order
        final var operation = redisDataSource
                .execute("ZADD", keys.origins(identity), "GT", String.valueOf(seenAt.toEpochMilli()), origin)
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "recordOrigin");
    }
}
