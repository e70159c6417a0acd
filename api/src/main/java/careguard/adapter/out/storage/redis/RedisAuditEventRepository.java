package careguard.adapter.out.storage.redis;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.keys.ReactiveKeyCommands;
import io.quarkus.redis.datasource.sortedset.ReactiveSortedSetCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.audit.AuditEvent;
import careguard.core.port.out.AuditEventRepository;

/**
 * Redis audit sink.
 *
 * <p>Each identity's events live in a sorted set scored by event time, stored
 * as JSON. The set expires at the retention marker of its newest event, so
 * nothing is purged before its own retention period ends.
 */
public class RedisAuditEventRepository implements AuditEventRepository {

    private static final Logger LOG = Logger.getLogger(RedisAuditEventRepository.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveSortedSetCommands<String, String> sortedSetCommands;
    private final ReactiveKeyCommands<String> keyCommands;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisAuditEventRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.sortedSetCommands = redisDataSource.sortedSet(String.class, String.class);
        this.keyCommands = redisDataSource.key(String.class);
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Void> append(AuditEvent event) {
        final String json;
        try {
            json = OBJECT_MAPPER.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            return Uni.createFrom().failure(new IllegalArgumentException("Unserializable audit event " + event.id(), e));
        }

        final var key = keys.audit(event.identity());
        var operation = sortedSetCommands
                .zadd(key, event.timestamp().toEpochMilli(), json)
                .replaceWithVoid();
        if (event.retainUntil() != null) {
            operation = operation.call(() -> keyCommands.pexpireat(key, event.retainUntil().toEpochMilli()));
        }
        return timeoutHelper.withTimeout(operation, "append");
    }

    @Override
    public Uni<List<AuditEvent>> findByIdentitySince(String identity, Instant since) {
        final var operation = redisDataSource
                .execute("ZRANGEBYSCORE", keys.audit(identity), String.valueOf(since.toEpochMilli()), "+inf")
                .map(RedisKeys::strings)
                .map(RedisAuditEventRepository::deserializeAll);
        return timeoutHelper.withTimeout(operation, "findByIdentitySince");
    }

    private static List<AuditEvent> deserializeAll(List<String> values) {
        final var events = new ArrayList<AuditEvent>(values.size());
        for (final var value : values) {
            try {
                events.add(OBJECT_MAPPER.readValue(value, AuditEvent.class));
            } catch (JsonProcessingException e) {
                LOG.warnf("Skipping unreadable audit record: %s", e.getOriginalMessage());
            }
        }
        events.sort(Comparator.comparing(AuditEvent::timestamp));
        return events;
    }
}
