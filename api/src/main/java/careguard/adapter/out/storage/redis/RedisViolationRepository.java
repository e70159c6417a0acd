package careguard.adapter.out.storage.redis;

import java.time.Instant;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.set.ReactiveSetCommands;
import io.quarkus.redis.datasource.value.ReactiveValueCommands;
import io.smallrye.mutiny.Multi;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.compliance.ComplianceViolation;
import careguard.core.model.compliance.ViolationStatus;
import careguard.core.model.compliance.ViolationType;
import careguard.core.port.out.ViolationRepository;

/**
 * Redis violation store.
 *
 * <p>Violations are JSON values written with SET NX, so a redelivered event
 * maps onto the existing record. Status sets back the review queue and a
 * per-identity, per-type sorted set backs the suppression window check.
 */
public class RedisViolationRepository implements ViolationRepository {

    private static final Logger LOG = Logger.getLogger(RedisViolationRepository.class);

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveValueCommands<String, String> valueCommands;
    private final ReactiveSetCommands<String, String> setCommands;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisViolationRepository(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.valueCommands = redisDataSource.value(String.class, String.class);
        this.setCommands = redisDataSource.set(String.class, String.class);
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Boolean> saveIfAbsent(ComplianceViolation violation) {
        final var operation = valueCommands
                .setnx(keys.violation(violation.id()), serialize(violation))
                .flatMap(created -> {
                    if (!created) {
                        LOG.debugf("Violation already stored: %s", violation.id());
                        return Uni.createFrom().item(false);
                    }
                    return setCommands
                            .sadd(keys.violationStatus(violation.status().name()), violation.id())
                            .call(() -> redisDataSource.execute(
                                    "ZADD",
                                    raisedKey(violation.identity(), violation.type()),
                                    String.valueOf(violation.timestamp().toEpochMilli()),
                                    violation.id()))
                            .replaceWith(true);
                });
        return timeoutHelper.withTimeout(operation, "saveIfAbsent");
    }

    @Override
    public Uni<Optional<ComplianceViolation>> findById(String id) {
        final var operation = valueCommands
                .get(keys.violation(id))
                .map(value -> Optional.ofNullable(value).map(RedisViolationRepository::deserialize));
        return timeoutHelper.withTimeout(operation, "findById");
    }

    @Override
    public Uni<ComplianceViolation> update(ComplianceViolation violation) {
        final var others = Arrays.stream(ViolationStatus.values())
                .filter(status -> status != violation.status())
                .toList();
        final var operation = valueCommands
                .set(keys.violation(violation.id()), serialize(violation))
                .call(() -> Uni.join()
                        .all(others.stream()
                                .map(status -> setCommands.srem(keys.violationStatus(status.name()), violation.id()))
                                .toList())
                        .andFailFast())
                .call(() -> setCommands.sadd(keys.violationStatus(violation.status().name()), violation.id()))
                .replaceWith(violation);
        return timeoutHelper.withTimeout(operation, "update");
    }

    @Override
    public Multi<ComplianceViolation> findByStatus(ViolationStatus status) {
        final var statuses = status != null ? List.of(status) : List.of(ViolationStatus.values());
        final var operation = Multi.createFrom()
                .iterable(statuses)
                .onItem()
                .transformToUniAndConcatenate(s -> setCommands.smembers(keys.violationStatus(s.name())))
                .collect()
                .in(LinkedHashSet<String>::new, Set::addAll)
                .flatMap(this::loadAll);
        return timeoutHelper
                .withTimeout(operation, "findByStatus")
                .onItem()
                .transformToMulti(violations -> Multi.createFrom().iterable(violations));
    }

    @Override
    public Uni<Boolean> existsSince(String identity, ViolationType type, Instant since) {
        final var operation = redisDataSource
                .execute("ZCOUNT", raisedKey(identity, type), String.valueOf(since.toEpochMilli()), "+inf")
                .map(response -> response != null && response.toLong() > 0);
        return timeoutHelper.withTimeout(operation, "existsSince");
    }

    private Uni<List<ComplianceViolation>> loadAll(Set<String> ids) {
        if (ids.isEmpty()) {
            return Uni.createFrom().item(List.of());
        }
        final var violationKeys = ids.stream().map(keys::violation).toArray(String[]::new);
        return valueCommands.mget(violationKeys).map(values -> values.values().stream()
                .filter(value -> value != null)
                .map(RedisViolationRepository::deserialize)
                .sorted(Comparator.comparing(ComplianceViolation::timestamp))
                .toList());
    }

    private String raisedKey(String identity, ViolationType type) {
        return keys.violationsRaised(identity != null ? identity : "anonymous", type.name());
    }

    private static String serialize(ComplianceViolation violation) {
        try {
            return OBJECT_MAPPER.writeValueAsString(violation);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Unserializable violation " + violation.id(), e);
        }
    }

    private static ComplianceViolation deserialize(String value) {
        try {
            return OBJECT_MAPPER.readValue(value, ComplianceViolation.class);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unreadable violation record", e);
        }
    }
}
