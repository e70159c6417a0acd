package careguard.adapter.out.storage.memory;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.model.account.Account;
import careguard.core.model.account.FailureState;
import careguard.core.port.out.CredentialStore;

/**
 * In-memory stand-in for the external user directory.
 *
 * <p>Intended for development and tests. Failure-state updates use
 * {@link ConcurrentMap#computeIfPresent} so each one is atomic per account.
 */
public class InMemoryCredentialStore implements CredentialStore {

    private static final Logger LOG = Logger.getLogger(InMemoryCredentialStore.class);

    private final ConcurrentMap<String, Account> accounts = new ConcurrentHashMap<>();

    /**
     * Add or replace an account (development seeding and tests).
     */
    public void put(Account account) {
        accounts.put(Account.normalize(account.identity()), account);
    }

    @Override
    public Uni<Optional<Account>> findByIdentity(String identity) {
        return Uni.createFrom().item(() -> Optional.ofNullable(accounts.get(identity)));
    }

    @Override
    public Uni<Void> updateFailureState(String identity, int failedAttempts, Instant lockExpiry) {
        return Uni.createFrom().item(() -> {
            accounts.computeIfPresent(identity, (k, account) -> account.withFailureState(failedAttempts, lockExpiry));
            return null;
        });
    }

    @Override
    public Uni<Void> resetFailureState(String identity) {
        return updateFailureState(identity, 0, null);
    }

    @Override
    public Uni<Boolean> resetFailureStateIfUnchanged(
            String identity, int expectedFailedAttempts, Instant expectedLockExpiry) {
        return Uni.createFrom().item(() -> {
            final var reset = new AtomicBoolean();
            accounts.computeIfPresent(identity, (k, account) -> {
                if (account.failedAttempts() != expectedFailedAttempts
                        || !Objects.equals(account.lockExpiry(), expectedLockExpiry)) {
                    return account;
                }
                reset.set(true);
                return account.withFailureState(0, null);
            });
            return reset.get();
        });
    }

    @Override
    public Uni<FailureState> recordFailure(String identity, int maxFailures, Duration lockDuration, Instant now) {
        return Uni.createFrom().item(() -> {
            final var updated = accounts.computeIfPresent(identity, (k, account) -> {
                final var attempts = account.failedAttempts() + 1;
                final var lockExpiry = attempts >= maxFailures ? now.plus(lockDuration) : account.lockExpiry();
                return account.withFailureState(attempts, lockExpiry);
            });
            if (updated == null) {
                LOG.debugf("Failure recorded for unknown identity %s ignored", identity);
                return new FailureState(0, null);
            }
            final var locked = updated.isLocked(now) ? updated.lockExpiry() : null;
            return new FailureState(updated.failedAttempts(), locked);
        });
    }

    /**
     * Clear all accounts (for testing).
     */
    public void clear() {
        accounts.clear();
    }
}
