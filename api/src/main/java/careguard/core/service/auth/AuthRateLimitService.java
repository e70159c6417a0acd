package careguard.core.service.auth;

import java.time.Clock;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.AuthRateLimitConfig;
import careguard.core.model.auth.AttemptCounter;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.auth.RateLimitDecision;
import careguard.core.port.out.AttemptCounterRepository;
import careguard.core.port.out.StoreUnavailableException;

/**
 * Login rate limiting (brute force protection).
 *
 * <p>Attempts are counted per identity and per network origin in fixed windows
 * anchored at the first attempt. Each key is checked and incremented in one
 * atomic store operation, identity first. An origin flooding many identities is
 * bounded by the origin threshold independently of per-account lockout.
 *
 * <p>Store failures fail closed: they surface as {@link StoreUnavailableException}
 * and the caller denies the attempt.
 */
@ApplicationScoped
public class AuthRateLimitService {

    private static final Logger LOG = Logger.getLogger(AuthRateLimitService.class);

    static final String IDENTITY_PREFIX = "identity:";
    static final String ORIGIN_PREFIX = "origin:";

    private final AuthRateLimitConfig config;
    private final AttemptCounterRepository repository;
    private final Clock clock;

    public AuthRateLimitService(AuthRateLimitConfig config, AttemptCounterRepository repository, Clock clock) {
        this.config = config;
        this.repository = repository;
        this.clock = clock;
    }

    /**
     * Check whether a login attempt may proceed and count it if so.
     *
     * @param identity normalised identity (may be null)
     * @param origin   client network origin (unknown origins are not counted)
     * @return Uni with the decision; fails with {@link StoreUnavailableException}
     *         when the counter store cannot answer
     */
    public Uni<RateLimitDecision> checkAndRecord(String identity, String origin) {
        if (!config.enabled()) {
            return Uni.createFrom().item(RateLimitDecision.allow(0, 0));
        }

        final var identityKey = identity != null ? IDENTITY_PREFIX + identity : null;
        final var originKey = ClientInfo.isKnownOrigin(origin) ? ORIGIN_PREFIX + origin : null;

        final Uni<RateLimitDecision> identityCheck = identityKey != null
                ? consume(identityKey, config.maxAttemptsPerIdentity())
                : Uni.createFrom().item(RateLimitDecision.allow(0, config.maxAttemptsPerIdentity()));

        return identityCheck.flatMap(identityResult -> {
            if (!identityResult.allowed() || originKey == null) {
                return Uni.createFrom().item(identityResult);
            }
            return consume(originKey, config.maxAttemptsPerOrigin()).map(originResult -> {
                if (!originResult.allowed()) {
                    return originResult;
                }
                return identityResult;
            });
        });
    }

    private Uni<RateLimitDecision> consume(String key, int threshold) {
        final var now = clock.instant();
        return repository
                .incrementIfBelow(key, threshold, config.window(), now)
                .map(result -> {
                    final var counter = result.counter();
                    if (result.permitted()) {
                        LOG.debugf("Attempt counted for %s: %d/%d", key, counter.count(), threshold);
                        return RateLimitDecision.allow(counter.count(), threshold);
                    }
                    LOG.infof("Login attempts rate limited for %s: %d/%d", key, counter.count(), threshold);
                    return RateLimitDecision.rejected(
                            key, counter.count(), threshold, counter.windowEnd(config.window()));
                })
                .onFailure()
                .transform(error -> asStoreFailure(error, "incrementIfBelow"));
    }

    /**
     * Clear the identity counter after a successful login.
     *
     * @param identity normalised identity
     * @return Uni completing when cleared
     */
    public Uni<Void> clearIdentity(String identity) {
        if (!config.enabled() || identity == null) {
            return Uni.createFrom().voidItem();
        }
        LOG.debugf("Clearing attempt counter for %s", identity);
        return repository.reset(IDENTITY_PREFIX + identity);
    }

    /**
     * Current identity counter, for administration.
     */
    public Uni<Optional<AttemptCounter>> identityCounter(String identity) {
        return repository.find(IDENTITY_PREFIX + identity, config.window(), clock.instant());
    }

    private static Throwable asStoreFailure(Throwable error, String operation) {
        if (error instanceof StoreUnavailableException) {
            return error;
        }
        return new StoreUnavailableException("attempt-counters", operation, error);
    }
}
