package careguard.adapter.out.storage.redis;

import java.time.Duration;
import java.time.Instant;
import java.util.Arrays;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;

import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import io.quarkus.redis.datasource.hash.ReactiveHashCommands;
import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.account.Account;
import careguard.core.model.account.FailureState;
import careguard.core.port.out.CredentialStore;

/**
 * Reads accounts from the user directory's Redis hashes and updates their
 * failure state.
 *
 * <p>Hash fields: {@code credentialHash}, {@code role}, {@code permissions}
 * (comma separated), {@code failedAttempts}, {@code lockExpiry} (epoch millis,
 * 0 when unlocked), {@code mfaSecret}. Failure-state writes are Lua scripts that
 * only touch an existing hash, so an unknown identity never gets a stub record.
 */
public class RedisCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(RedisCredentialStore.class);

    /**
     * Returns array: [failedAttempts, lockExpiryMs] or [-1, 0] when the account does not exist.
     */
    private static final String RECORD_FAILURE_SCRIPT =
            """
            local key = KEYS[1]
            if redis.call('EXISTS', key) == 0 then
                return {-1, 0}
            end
            local max_failures = tonumber(ARGV[1])
            local now_ms = tonumber(ARGV[2])
            local lock_ms = tonumber(ARGV[3])

            local attempts = tonumber(redis.call('HGET', key, 'failedAttempts') or '0') + 1
            local lock_expiry = tonumber(redis.call('HGET', key, 'lockExpiry') or '0')
            if attempts >= max_failures then
                lock_expiry = now_ms + lock_ms
            end
            redis.call('HSET', key, 'failedAttempts', attempts, 'lockExpiry', lock_expiry)
            return {attempts, lock_expiry}
            """;

    private static final String SET_FAILURE_STATE_SCRIPT =
            """
            local key = KEYS[1]
            if redis.call('EXISTS', key) == 0 then
                return 0
            end
            redis.call('HSET', key, 'failedAttempts', ARGV[1], 'lockExpiry', ARGV[2])
            return 1
            """;

    /**
     * Returns 1 when reset, 0 when the stored state differs from ARGV, -1 when the account does not exist.
     */
    private static final String RESET_IF_UNCHANGED_SCRIPT =
            """
            local key = KEYS[1]
            if redis.call('EXISTS', key) == 0 then
                return -1
            end
            local attempts = tonumber(redis.call('HGET', key, 'failedAttempts') or '0')
            local lock_expiry = tonumber(redis.call('HGET', key, 'lockExpiry') or '0')
            if attempts ~= tonumber(ARGV[1]) or lock_expiry ~= tonumber(ARGV[2]) then
                return 0
            end
            redis.call('HSET', key, 'failedAttempts', 0, 'lockExpiry', 0)
            return 1
            """;

    private final ReactiveRedisDataSource redisDataSource;
    private final ReactiveHashCommands<String, String, String> hashCommands;
    private final RedisKeys keys;
    private final RedisTimeoutHelper timeoutHelper;

    public RedisCredentialStore(
            ReactiveRedisDataSource redisDataSource, String keyPrefix, RedisTimeoutHelper timeoutHelper) {
        this.redisDataSource = redisDataSource;
        this.hashCommands = redisDataSource.hash(String.class, String.class, String.class);
        this.keys = new RedisKeys(keyPrefix);
        this.timeoutHelper = timeoutHelper;
    }

    @Override
    public Uni<Optional<Account>> findByIdentity(String identity) {
        final var operation = hashCommands.hgetall(keys.account(identity)).map(fields -> {
            if (fields == null || fields.isEmpty()) {
                return Optional.<Account>empty();
            }
            return Optional.of(toAccount(identity, fields));
        });
        return timeoutHelper.withTimeout(operation, "findByIdentity");
    }

    @Override
    public Uni<Void> updateFailureState(String identity, int failedAttempts, Instant lockExpiry) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        SET_FAILURE_STATE_SCRIPT,
                        "1",
                        keys.account(identity),
                        String.valueOf(failedAttempts),
                        String.valueOf(lockExpiry != null ? lockExpiry.toEpochMilli() : 0L))
                .invoke(response -> {
                    if (response == null || response.toInteger() == 0) {
                        LOG.debugf("Failure state not updated, no account for %s", identity);
                    }
                })
                .replaceWithVoid();
        return timeoutHelper.withTimeout(operation, "updateFailureState");
    }

    @Override
    public Uni<Void> resetFailureState(String identity) {
        return updateFailureState(identity, 0, null);
    }

    @Override
    public Uni<Boolean> resetFailureStateIfUnchanged(
            String identity, int expectedFailedAttempts, Instant expectedLockExpiry) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        RESET_IF_UNCHANGED_SCRIPT,
                        "1",
                        keys.account(identity),
                        String.valueOf(expectedFailedAttempts),
                        String.valueOf(expectedLockExpiry != null ? expectedLockExpiry.toEpochMilli() : 0L))
                .map(response -> {
                    final var result = response != null ? response.toInteger() : -1;
                    if (result == 0) {
                        LOG.debugf("Failure state of %s changed since read, reset skipped", identity);
                    }
                    return result == 1;
                });
        return timeoutHelper.withTimeout(operation, "resetFailureStateIfUnchanged");
    }

    @Override
    public Uni<FailureState> recordFailure(String identity, int maxFailures, Duration lockDuration, Instant now) {
        final var operation = redisDataSource
                .execute(
                        "EVAL",
                        RECORD_FAILURE_SCRIPT,
                        "1",
                        keys.account(identity),
                        String.valueOf(maxFailures),
                        String.valueOf(now.toEpochMilli()),
                        String.valueOf(lockDuration.toMillis()))
                .map(RedisKeys::longs)
                .map(values -> {
                    if (values.get(0) < 0) {
                        return new FailureState(0, null);
                    }
                    final var lockExpiry = values.get(1) > now.toEpochMilli() ? Instant.ofEpochMilli(values.get(1)) : null;
                    return new FailureState(values.get(0).intValue(), lockExpiry);
                });
        return timeoutHelper.withTimeout(operation, "recordFailure");
    }

    private static Account toAccount(String identity, Map<String, String> fields) {
        final var permissions = fields.getOrDefault("permissions", "");
        final var lockExpiry = parseLong(fields.get("lockExpiry"));
        return new Account(
                identity,
                fields.get("credentialHash"),
                fields.get("role"),
                Arrays.stream(permissions.split(","))
                        .map(String::trim)
                        .filter(p -> !p.isEmpty())
                        .collect(Collectors.toSet()),
                (int) parseLong(fields.get("failedAttempts")),
                lockExpiry > 0 ? Instant.ofEpochMilli(lockExpiry) : null,
                fields.get("mfaSecret"));
    }

    private static long parseLong(String value) {
        if (value == null || value.isBlank()) {
            return 0L;
        }
        return Long.parseLong(value.trim());
    }
}
