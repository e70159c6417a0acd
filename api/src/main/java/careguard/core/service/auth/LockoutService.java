package careguard.core.service.auth;

import java.time.Clock;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.LockoutConfig;
import careguard.core.model.account.Account;
import careguard.core.model.account.FailureState;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.port.in.LockoutManagement;
import careguard.core.port.out.CredentialStore;
import careguard.core.port.out.StoreUnavailableException;
import careguard.core.service.audit.AuditLogger;

/**
 * Per-account lockout state machine.
 *
 * <p>States are {@code unlocked} and {@code locked}. The failure that brings the
 * consecutive-failure counter to the maximum locks the account for a fixed
 * duration. A lock that has run out is cleared lazily by the next attempt,
 * together with the counter. A successful verification resets the counter.
 *
 * <p>All writes are single-account operations on the credential store. Store
 * failures surface as {@link StoreUnavailableException} so the caller fails closed.
 */
@ApplicationScoped
public class LockoutService implements LockoutManagement {

    private static final Logger LOG = Logger.getLogger(LockoutService.class);

    private static final String STORE = "credential-store";

    private final LockoutConfig config;
    private final CredentialStore credentialStore;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public LockoutService(
            LockoutConfig config, CredentialStore credentialStore, AuditLogger auditLogger, Clock clock) {
        this.config = config;
        this.credentialStore = credentialStore;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    /**
     * Check whether the account is locked right now.
     */
    public boolean isLocked(Account account) {
        return account != null && account.isLocked(clock.instant());
    }

    /**
     * Clear a lock that has already expired, resetting the failure counter.
     *
     * <p>The reset only applies if the stored state is still the one that was
     * read. Otherwise the current state is read back and returned.
     *
     * @param account account as read from the store
     * @return the account with its effective failure state
     */
    public Uni<Account> releaseIfExpired(Account account) {
        if (!account.hasExpiredLock(clock.instant())) {
            return Uni.createFrom().item(account);
        }
        LOG.infof("Lock on %s expired at %s, resetting failure state", account.identity(), account.lockExpiry());
        return resetIfUnchanged(account);
    }

    /**
     * Record a failed verification and lock the account once the maximum is reached.
     *
     * @param identity normalised identity of an existing account
     * @return failure state after the update
     */
    public Uni<FailureState> recordFailure(String identity) {
        return credentialStore
                .recordFailure(identity, config.maxFailedAttempts(), config.lockDuration(), clock.instant())
                .invoke(state -> {
                    if (state.locked()) {
                        LOG.warnf(
                                "Account locked: %s after %d failed attempts, until %s",
                                identity, state.failedAttempts(), state.lockExpiry());
                    } else {
                        LOG.debugf(
                                "Failed attempt recorded for %s: %d/%d",
                                identity, state.failedAttempts(), config.maxFailedAttempts());
                    }
                })
                .onFailure()
                .transform(error -> asStoreFailure(error, "recordFailure"));
    }

    /**
     * Reset the failure counter after a successful verification.
     *
     * <p>A failure recorded between the caller's read and this reset wins: the
     * counter is left alone and the current state is returned, so a lock set in
     * that gap stays in force.
     *
     * @param account the verified account, as read before verification
     * @return the account with its current failure state
     */
    public Uni<Account> recordSuccess(Account account) {
        if (account.failedAttempts() == 0 && account.lockExpiry() == null) {
            return Uni.createFrom().item(account);
        }
        return resetIfUnchanged(account);
    }

    @Override
    public Uni<Optional<FailureState>> lockoutStatus(String identity) {
        final var normalized = Account.normalize(identity);
        final var now = clock.instant();
        return credentialStore
                .findByIdentity(normalized)
                .map(found -> found.map(account -> new FailureState(
                        account.failedAttempts(), account.isLocked(now) ? account.lockExpiry() : null)))
                .onFailure()
                .transform(error -> asStoreFailure(error, "findByIdentity"));
    }

    @Override
    public Uni<Void> clearLockout(String identity, String actor) {
        final var normalized = Account.normalize(identity);
        LOG.infof("Clearing lockout for %s (requested by %s)", normalized, actor);
        return credentialStore
                .resetFailureState(normalized)
                .onFailure()
                .transform(error -> asStoreFailure(error, "resetFailureState"))
                .call(() -> auditLogger.record(
                        AuditEvent.builder(AuditEventType.AUTHENTICATION, AuditActions.LOCKOUT_CLEARED)
                                .identity(normalized)
                                .success(true)
                                .metadata(Map.of("actor", actor != null ? actor : "unknown"))
                                .build()));
    }

    public int maxFailedAttempts() {
        return config.maxFailedAttempts();
    }

    private Uni<Account> resetIfUnchanged(Account account) {
        return credentialStore
                .resetFailureStateIfUnchanged(account.identity(), account.failedAttempts(), account.lockExpiry())
                .flatMap(reset -> {
                    if (reset) {
                        return Uni.createFrom().item(account.withFailureState(0, null));
                    }
                    LOG.debugf("Failure state of %s changed concurrently, re-reading", account.identity());
                    return credentialStore
                            .findByIdentity(account.identity())
                            .map(found -> found.orElse(account));
                })
                .onFailure()
                .transform(error -> asStoreFailure(error, "resetFailureStateIfUnchanged"));
    }

    private static Throwable asStoreFailure(Throwable error, String operation) {
        if (error instanceof StoreUnavailableException) {
            return error;
        }
        return new StoreUnavailableException(STORE, operation, error);
    }
}
