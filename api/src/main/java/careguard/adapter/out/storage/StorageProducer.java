package careguard.adapter.out.storage;

import java.time.Clock;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Disposes;
import jakarta.enterprise.inject.Instance;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Inject;

import io.micrometer.core.instrument.MeterRegistry;
import io.quarkus.redis.datasource.ReactiveRedisDataSource;
import org.jboss.logging.Logger;

import careguard.adapter.out.storage.memory.InMemoryAttemptCounterRepository;
import careguard.adapter.out.storage.memory.InMemoryAuditEventRepository;
import careguard.adapter.out.storage.memory.InMemoryCredentialStore;
import careguard.adapter.out.storage.memory.InMemoryOriginHistoryRepository;
import careguard.adapter.out.storage.memory.InMemorySessionRepository;
import careguard.adapter.out.storage.memory.InMemoryViolationRepository;
import careguard.adapter.out.storage.redis.RedisAttemptCounterRepository;
import careguard.adapter.out.storage.redis.RedisAuditEventRepository;
import careguard.adapter.out.storage.redis.RedisCredentialStore;
import careguard.adapter.out.storage.redis.RedisOriginHistoryRepository;
import careguard.adapter.out.storage.redis.RedisSessionRepository;
import careguard.adapter.out.storage.redis.RedisTimeoutHelper;
import careguard.adapter.out.storage.redis.RedisViolationRepository;
import careguard.core.config.StorageConfig;
import careguard.core.port.out.AttemptCounterRepository;
import careguard.core.port.out.AuditEventRepository;
import careguard.core.port.out.CredentialStore;
import careguard.core.port.out.OriginHistoryRepository;
import careguard.core.port.out.SessionRepository;
import careguard.core.port.out.ViolationRepository;

/**
 * CDI producer for every storage port.
 *
 * <p>Selects the implementation from {@code careguard.storage.provider}. The
 * Redis data source is resolved lazily so the memory provider runs without a
 * Redis client configured.
 */
@ApplicationScoped
public class StorageProducer {

    private static final Logger LOG = Logger.getLogger(StorageProducer.class);

    static final String MEMORY = "memory";
    static final String REDIS = "redis";

    private final StorageConfig config;
    private final Instance<ReactiveRedisDataSource> redisDataSource;
    private final Instance<MeterRegistry> meterRegistry;
    private final Clock clock;

    @Inject
    public StorageProducer(
            StorageConfig config,
            Instance<ReactiveRedisDataSource> redisDataSource,
            Instance<MeterRegistry> meterRegistry,
            Clock clock) {
        this.config = config;
        this.redisDataSource = redisDataSource;
        this.meterRegistry = meterRegistry;
        this.clock = clock;
        LOG.infof("Storage provider: %s", provider());
    }

    @Produces
    @ApplicationScoped
    public CredentialStore credentialStore() {
        if (useRedis()) {
            return new RedisCredentialStore(redis(), keyPrefix(), timeoutHelper("credential-store"));
        }
        return new InMemoryCredentialStore();
    }

    @Produces
    @ApplicationScoped
    public AttemptCounterRepository attemptCounterRepository() {
        if (useRedis()) {
            return new RedisAttemptCounterRepository(redis(), keyPrefix(), timeoutHelper("attempt-counters"));
        }
        return new InMemoryAttemptCounterRepository(clock);
    }

    void closeAttemptCounters(@Disposes AttemptCounterRepository repository) {
        if (repository instanceof InMemoryAttemptCounterRepository inMemory) {
            inMemory.shutdown();
        }
    }

    @Produces
    @ApplicationScoped
    public SessionRepository sessionRepository() {
        if (useRedis()) {
            return new RedisSessionRepository(redis(), keyPrefix(), timeoutHelper("sessions"));
        }
        return new InMemorySessionRepository();
    }

    @Produces
    @ApplicationScoped
    public AuditEventRepository auditEventRepository() {
        if (useRedis()) {
            return new RedisAuditEventRepository(redis(), keyPrefix(), timeoutHelper("audit-sink"));
        }
        return new InMemoryAuditEventRepository();
    }

    @Produces
    @ApplicationScoped
    public OriginHistoryRepository originHistoryRepository() {
        if (useRedis()) {
            return new RedisOriginHistoryRepository(redis(), keyPrefix(), timeoutHelper("origin-history"));
        }
        return new InMemoryOriginHistoryRepository();
    }

    @Produces
    @ApplicationScoped
    public ViolationRepository violationRepository() {
        if (useRedis()) {
            return new RedisViolationRepository(redis(), keyPrefix(), timeoutHelper("violations"));
        }
        return new InMemoryViolationRepository();
    }

    private String provider() {
        return config.provider().trim().toLowerCase();
    }

    private boolean useRedis() {
        final var provider = provider();
        if (REDIS.equals(provider)) {
            return true;
        }
        if (!MEMORY.equals(provider)) {
            throw new IllegalStateException("Unknown storage provider: " + config.provider());
        }
        return false;
    }

    private ReactiveRedisDataSource redis() {
        if (!redisDataSource.isResolvable()) {
            throw new IllegalStateException("Storage provider is redis but no Redis client is configured");
        }
        return redisDataSource.get();
    }

    private String keyPrefix() {
        return config.redis().keyPrefix();
    }

    private RedisTimeoutHelper timeoutHelper(String repositoryName) {
        final var registry = meterRegistry.isResolvable() ? meterRegistry.get() : null;
        return new RedisTimeoutHelper(config.timeout(), registry, repositoryName);
    }
}
