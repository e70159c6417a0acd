package careguard.core.service.auth;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.MfaConfig;
import careguard.core.model.account.Account;
import careguard.core.model.account.FailureState;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.auth.AuthFailure;
import careguard.core.model.auth.AuthenticationResult;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.auth.RateLimitDecision;
import careguard.core.port.in.AuthenticationUseCase;
import careguard.core.port.in.SessionManagement;
import careguard.core.port.out.CredentialStore;
import careguard.core.service.audit.AuditLogger;
import careguard.core.service.session.SessionTokenService;

/**
 * Login orchestration: rate limit, lockout, credential verification, then
 * session issuance or failure accounting.
 *
 * <p>Every outcome is written to the audit trail. Callers only ever see the
 * coarse {@link AuthFailure} categories; the audit records keep the internal
 * reason (for example an unknown identity versus a wrong secret).
 *
 * <p>When the attempt counter is exhausted the account's lock state is still
 * read, so that an attempt against a locked account reports
 * {@link AuthFailure#ACCOUNT_LOCKED} rather than {@link AuthFailure#RATE_LIMITED}.
 * The secret is never checked in either case.
 */
@ApplicationScoped
public class AuthenticationService implements AuthenticationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthenticationService.class);

    private final AuthRateLimitService rateLimiter;
    private final LockoutService lockout;
    private final CredentialVerifier verifier;
    private final TotpVerifier totpVerifier;
    private final CredentialStore credentialStore;
    private final SessionManagement sessions;
    private final SessionTokenService tokenService;
    private final AuditLogger auditLogger;
    private final MfaConfig mfaConfig;
    private final Clock clock;

    public AuthenticationService(
            AuthRateLimitService rateLimiter,
            LockoutService lockout,
            CredentialVerifier verifier,
            TotpVerifier totpVerifier,
            CredentialStore credentialStore,
            SessionManagement sessions,
            SessionTokenService tokenService,
            AuditLogger auditLogger,
            MfaConfig mfaConfig,
            Clock clock) {
        this.rateLimiter = rateLimiter;
        this.lockout = lockout;
        this.verifier = verifier;
        this.totpVerifier = totpVerifier;
        this.credentialStore = credentialStore;
        this.sessions = sessions;
        this.tokenService = tokenService;
        this.auditLogger = auditLogger;
        this.mfaConfig = mfaConfig;
        this.clock = clock;
    }

    @Override
    public Uni<AuthenticationResult> authenticate(String identity, String secret, ClientInfo client) {
        final var normalized = Account.normalize(identity);
        if (normalized == null || normalized.isEmpty()) {
            return verifier.verifyAsync(null, secret)
                    .flatMap(ignored -> deny(
                            AuthenticationResult.Denied.of(AuthFailure.INVALID_CREDENTIALS),
                            failedLogin(null, client, "missing_identity").build()));
        }

        return rateLimiter
                .checkAndRecord(normalized, client.originAddress())
                .flatMap(decision -> decision.allowed()
                        ? attempt(normalized, secret, client)
                        : rejectLimited(normalized, client, decision))
                .onFailure()
                .recoverWithUni(error -> storeUnavailable(normalized, client, error));
    }

    private Uni<AuthenticationResult> attempt(String identity, String secret, ClientInfo client) {
        return credentialStore.findByIdentity(identity).flatMap(found -> {
            if (found.isEmpty()) {
                return verifier.verifyAsync(null, secret)
                        .flatMap(ignored -> deny(
                                AuthenticationResult.Denied.of(AuthFailure.INVALID_CREDENTIALS),
                                failedLogin(identity, client, "unknown_identity").build()));
            }
            return lockout.releaseIfExpired(found.get()).flatMap(account -> {
                if (lockout.isLocked(account)) {
                    return rejectLocked(account, client);
                }
                return verifier.verifyAsync(account, secret)
                        .flatMap(verified -> verified
                                ? onVerified(account, client)
                                : onWrongSecret(account, client));
            });
        });
    }

    private Uni<AuthenticationResult> onWrongSecret(Account account, ClientInfo client) {
        return lockout.recordFailure(account.identity()).flatMap(state -> deny(
                AuthenticationResult.Denied.of(AuthFailure.INVALID_CREDENTIALS),
                failedLogin(account.identity(), client, "invalid_secret")
                        .metadata(failureMetadata("invalid_secret", state))
                        .build()));
    }

    private Uni<AuthenticationResult> onVerified(Account account, ClientInfo client) {
        return lockout.recordSuccess(account).flatMap(current -> {
            if (lockout.isLocked(current)) {
                // Locked by a concurrent failure after this attempt read the account.
                return rejectLocked(current, client);
            }
            return rateLimiter
                    .clearIdentity(current.identity())
                    .flatMap(v -> current.mfaEnabled() ? challenge(current, client) : grant(current, client, false));
        });
    }

    private Uni<AuthenticationResult> challenge(Account account, ClientInfo client) {
        final var now = clock.instant();
        final var expiresAt = now.plus(mfaConfig.challengeTtl());
        final var token = tokenService.signChallenge(account.identity(), now, expiresAt);
        LOG.debugf("Password verified for %s, MFA challenge issued", account.identity());
        return auditLogger
                .record(event(AuditActions.MFA_REQUIRED, account.identity(), client, true)
                        .metadata(Map.of("challengeExpiresAt", expiresAt.toString()))
                        .build())
                .replaceWith(new AuthenticationResult.MfaRequired(token, expiresAt));
    }

    private Uni<AuthenticationResult> grant(Account account, ClientInfo client, boolean viaMfa) {
        return sessions.issue(account).flatMap(issued -> {
            final var session = issued.session();
            final var action = viaMfa ? AuditActions.MFA_SUCCESS : AuditActions.LOGIN_SUCCESS;
            return auditLogger
                    .record(event(action, account.identity(), client, true)
                            .metadata(Map.of("sessionId", session.id()))
                            .build())
                    .replaceWith(new AuthenticationResult.Granted(
                            account.identity(), issued.token(), session.expiresAt()));
        });
    }

    private Uni<AuthenticationResult> rejectLimited(String identity, ClientInfo client, RateLimitDecision decision) {
        // Lock state wins over the attempt counter; the secret is not checked either way.
        return credentialStore
                .findByIdentity(identity)
                .map(found -> found.filter(lockout::isLocked))
                .onFailure()
                .recoverWithItem(error -> {
                    LOG.warnf("Lock state unavailable for rate limited identity %s: %s", identity, error.getMessage());
                    return Optional.empty();
                })
                .flatMap(locked -> {
                    if (locked.isPresent()) {
                        return rejectLocked(locked.get(), client);
                    }
                    final var retryAfter = decision.retryAfterSeconds(clock.instant());
                    return deny(
                            new AuthenticationResult.Denied(AuthFailure.RATE_LIMITED, retryAfter),
                            event(AuditActions.RATE_LIMITED, identity, client, false)
                                    .metadata(Map.of(
                                            "key", decision.key(),
                                            "attempts", decision.attempts(),
                                            "threshold", decision.threshold()))
                                    .build());
                });
    }

    private Uni<AuthenticationResult> rejectLocked(Account account, ClientInfo client) {
        final var retryAfter = Math.max(1, Duration.between(clock.instant(), account.lockExpiry()).toSeconds());
        LOG.debugf("Attempt against locked account %s, lock ends %s", account.identity(), account.lockExpiry());
        return deny(
                new AuthenticationResult.Denied(AuthFailure.ACCOUNT_LOCKED, retryAfter),
                event(AuditActions.ACCOUNT_LOCKED, account.identity(), client, false)
                        .metadata(Map.of("lockExpiry", account.lockExpiry().toString()))
                        .build());
    }

    private Uni<AuthenticationResult> storeUnavailable(String identity, ClientInfo client, Throwable error) {
        LOG.errorf(error, "Authentication denied for %s: backing store unavailable", identity);
        return deny(
                AuthenticationResult.Denied.of(AuthFailure.STORE_UNAVAILABLE),
                event(AuditActions.STORE_UNAVAILABLE, identity, client, false)
                        .metadata(Map.of("error", error.getClass().getSimpleName()))
                        .build())
                .onFailure()
                .recoverWithItem(AuthenticationResult.Denied.of(AuthFailure.STORE_UNAVAILABLE));
    }

    @Override
    public Uni<AuthenticationResult> completeMfa(String challengeToken, String code, ClientInfo client) {
        final var challenge = tokenService.verifyChallenge(challengeToken);
        if (!challenge.valid()) {
            final var action = challenge.expired() ? AuditActions.MFA_EXPIRED : AuditActions.MFA_FAILED;
            return deny(
                    AuthenticationResult.Denied.of(AuthFailure.MFA_FAILED),
                    event(action, challenge.identity(), client, false)
                            .metadata(Map.of("reason", challenge.reason()))
                            .build());
        }

        final var identity = challenge.identity();
        return rateLimiter
                .checkAndRecord(identity, client.originAddress())
                .flatMap(decision -> decision.allowed()
                        ? verifySecondFactor(identity, code, client)
                        : rejectLimited(identity, client, decision))
                .onFailure()
                .recoverWithUni(error -> storeUnavailable(identity, client, error));
    }

    private Uni<AuthenticationResult> verifySecondFactor(String identity, String code, ClientInfo client) {
        return credentialStore.findByIdentity(identity).flatMap(found -> {
            if (found.isEmpty() || !found.get().mfaEnabled()) {
                return mfaFailed(identity, client, "mfa_not_configured");
            }
            final var account = found.get();
            if (lockout.isLocked(account)) {
                return rejectLocked(account, client);
            }
            if (!totpVerifier.verify(account.mfaSecret(), code, clock.instant())) {
                // Second-factor failures are audited but never touch the lockout counter.
                return mfaFailed(identity, client, "invalid_code");
            }
            return grant(account, client, true);
        });
    }

    private Uni<AuthenticationResult> mfaFailed(String identity, ClientInfo client, String reason) {
        return deny(
                AuthenticationResult.Denied.of(AuthFailure.MFA_FAILED),
                event(AuditActions.MFA_FAILED, identity, client, false)
                        .metadata(Map.of("reason", reason))
                        .build());
    }

    private Uni<AuthenticationResult> deny(AuthenticationResult.Denied denied, AuditEvent event) {
        return auditLogger.record(event).replaceWith(denied);
    }

    private AuditEvent.Builder failedLogin(String identity, ClientInfo client, String reason) {
        return event(AuditActions.FAILED_LOGIN, identity, client, false)
                .metadata(Map.of("reason", reason, "locked", false));
    }

    private AuditEvent.Builder event(String action, String identity, ClientInfo client, boolean success) {
        return AuditEvent.builder(AuditEventType.AUTHENTICATION, action)
                .identity(identity)
                .originAddress(client.originAddress())
                .userAgent(client.userAgent())
                .success(success);
    }

    private Map<String, Object> failureMetadata(String reason, FailureState state) {
        final var metadata = new HashMap<String, Object>();
        metadata.put("reason", reason);
        metadata.put("locked", state.locked());
        metadata.put("failedAttempts", state.failedAttempts());
        metadata.put("maxFailedAttempts", lockout.maxFailedAttempts());
        if (state.lockExpiry() != null) {
            metadata.put("lockExpiry", state.lockExpiry().toString());
        }
        return metadata;
    }
}
