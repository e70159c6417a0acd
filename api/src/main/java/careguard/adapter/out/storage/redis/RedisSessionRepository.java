package careguard.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Optional;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.session.Session;
import careguard.core.port.out.SessionRepository;

/**
 * Redis implementation of SessionRepository.
 *
 * <p>Session records expire with the session itself. Uses SET NX for atomic
 * insert-if-absent so a colliding id is reported instead of overwritten. Each
 * identity keeps a set of its session ids for bulk revocation.
 */
public class RedisSessionRepository implements SessionRepository {

    private static final Logger LOG = Logger.getLogger(RedisSessionRepository.class);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisSessionRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(Session session) {
        final var key = keys.session(session.id());
        final var value = serialize(session);
        // SET NX replies nil when the key already exists
        final var command = session.expiresAt() != null
                ? redisDataSource.execute(
                        "SET", key, value, "NX", "PXAT", String.valueOf(session.expiresAt().toEpochMilli()))
                : redisDataSource.execute("SET", key, value, "NX");

        final var operation = command.flatMap(reply -> {
            if (reply == null) {
                LOG.debugf("Session ID collision in Redis: %s", session.id());
                return Uni.createFrom().item(false);
            }
            return index(session).replaceWith(true);
        });
        return timeoutHelper.withTimeout(operation, "saveIfAbsent");
    }

    @Override
    public Uni<Optional<Session>> findById(String sessionId) {
        final var operation = valueCommands.get(keys.session(sessionId)).map(value -> {
            if (value == null) {
                return Optional.<Session>empty();
            }
            return Optional.of(deserialize(sessionId, value));
        });
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<Boolean> delete(String sessionId) {
        final var operation = findById(sessionId).flatMap(existing -> {
            if (existing.isEmpty()) {
                return Uni.createFrom().item(false);
            }
            final var identity = existing.get().identity();
            return keyCommands
                    .del(keys.session(sessionId))
                    .call(() -> setCommands.srem(keys.sessionIndex(identity), sessionId))
                    .map(deleted -> deleted > 0);
        });
        return timeoutHelper.withTimeout(operation, "delete");
    }

    @Override
    public Uni<Integer> deleteByIdentity(String identity) {
        final var indexKey = keys.sessionIndex(identity);
        final var operation = setCommands.smembers(indexKey).flatMap(ids -> {
            if (ids == null || ids.isEmpty()) {
                return Uni.createFrom().item(0);
            }
            final var sessionKeys = ids.stream().map(keys::session).toArray(String[]::new);
            return keyCommands.del(sessionKeys).call(() -> keyCommands.del(indexKey));
        });
        return timeoutHelper.withTimeout(operation, "deleteByIdentity");
    }

    private Uni<Void> index(Session session) {
        final var indexKey = keys.sessionIndex(session.identity());
        var operation = setCommands.sadd(indexKey, session.id()).replaceWithVoid();
        if (session.expiresAt() != null) {
            // The index lives as long as the newest session it lists
            operation = operation.call(() -> keyCommands.ttl(indexKey).flatMap(ttl -> {
                final var remaining = session.expiresAt().getEpochSecond() - Instant.now().getEpochSecond();
                if (ttl >= 0 && ttl >= remaining) {
                    return Uni.createFrom().voidItem();
                }
                return keyCommands.expireat(indexKey, session.expiresAt()).replaceWithVoid();
            }));
        }
        return operation;
    }

    private static String serialize(Session session) {
        return session.identity()
                + "|" + session.createdAt().toEpochMilli()
                + "|" + (session.expiresAt() != null ? session.expiresAt().toEpochMilli() : "");
    }

    private static Session deserialize(String id, String value) {
        final var parts = value.split("\\|", -1);
        if (parts.length < 3) {
            throw new IllegalArgumentException("Invalid session format");
        }
        return new Session(
                id,
                parts[0],
                Instant.ofEpochMilli(Long.parseLong(parts[1])),
                parts[2].isEmpty() ? null : Instant.ofEpochMilli(Long.parseLong(parts[2])));
    }
}
