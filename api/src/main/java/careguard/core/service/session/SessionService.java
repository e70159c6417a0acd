package careguard.core.service.session;

import java.time.Clock;
import java.time.Instant;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.SessionConfig;
import careguard.core.model.account.Account;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.session.IssuedSession;
import careguard.core.model.session.Session;
import careguard.core.model.session.SessionClaims;
import careguard.core.model.session.SessionValidationResult;
import careguard.core.port.in.SessionManagement;
import careguard.core.port.out.SessionRepository;
import careguard.core.port.out.StoreUnavailableException;
import careguard.core.service.audit.AuditLogger;

/**
 * Session lifecycle: issue with collision retry, two-step validation, revocation.
 *
 * <p>Validation first checks the token on its own (signature, issuer, expiry)
 * and then requires its session id to resolve in the session registry. A
 * revoked or expired registry entry invalidates an otherwise well-formed token.
 * Sessions have an absolute lifetime and are never renewed.
 */
@ApplicationScoped
public class SessionService implements SessionManagement {

    private static final Logger LOG = Logger.getLogger(SessionService.class);

    private final SessionRepository repository;
    private final SessionIdGenerator idGenerator;
    private final SessionTokenService tokenService;
    private final SessionConfig config;
    private final AuditLogger auditLogger;
    private final Clock clock;

    public SessionService(
            SessionRepository repository,
            SessionIdGenerator idGenerator,
            SessionTokenService tokenService,
            SessionConfig config,
            AuditLogger auditLogger,
            Clock clock) {
        this.repository = repository;
        this.idGenerator = idGenerator;
        this.tokenService = tokenService;
        this.config = config;
        this.auditLogger = auditLogger;
        this.clock = clock;
    }

    @Override
    public Uni<IssuedSession> issue(Account account) {
        final var now = clock.instant();
        final var expiresAt = now.plus(config.ttl());
        return issueWithRetry(account, now, expiresAt, 0);
    }

    private Uni<IssuedSession> issueWithRetry(Account account, Instant createdAt, Instant expiresAt, int attempt) {
        final var maxRetries = config.idGeneration().maxRetries();
        if (attempt >= maxRetries) {
            return Uni.createFrom()
                    .failure(new SessionCreationException(
                            "Failed to generate unique session ID after " + maxRetries + " attempts"));
        }

        final var session = new Session(idGenerator.generate(), account.identity(), createdAt, expiresAt);

        return repository.saveIfAbsent(session).flatMap(saved -> {
            if (saved) {
                LOG.infof("Session created: %s for %s", session.id(), account.identity());
                final var claims = new SessionClaims(
                        account.identity(),
                        account.role(),
                        account.permissions(),
                        session.id(),
                        createdAt,
                        expiresAt);
                return Uni.createFrom().item(new IssuedSession(session, tokenService.sign(claims)));
            }

            LOG.warnf("Session ID collision detected (attempt %d/%d), retrying", attempt + 1, maxRetries);
            return issueWithRetry(account, createdAt, expiresAt, attempt + 1);
        });
    }

    @Override
    public Uni<SessionValidationResult> validate(String token) {
        final var tokenResult = tokenService.verify(token);
        if (!(tokenResult instanceof SessionValidationResult.Valid valid)) {
            return Uni.createFrom().item(tokenResult);
        }

        final var claims = valid.claims();
        return repository
                .findById(claims.sessionId())
                .map(found -> {
                    if (found.isEmpty()) {
                        LOG.debugf("Session %s not registered (revoked or expired)", claims.sessionId());
                        return (SessionValidationResult) new SessionValidationResult.Invalid("session_revoked");
                    }
                    final var session = found.get();
                    if (!session.identity().equals(claims.identity())) {
                        LOG.warnf("Session %s does not belong to token subject %s", session.id(), claims.identity());
                        return new SessionValidationResult.Invalid("session_mismatch");
                    }
                    if (session.isExpired(clock.instant())) {
                        cleanUp(session.id());
                        return new SessionValidationResult.Expired("session_expired");
                    }
                    return valid;
                })
                .onFailure()
                .transform(error -> {
                    LOG.errorf("Session store unavailable while validating session %s: %s",
                            claims.sessionId(), error.getMessage());
                    if (error instanceof StoreUnavailableException) {
                        return error;
                    }
                    return new StoreUnavailableException("session-store", "findById", error);
                });
    }

    private void cleanUp(String sessionId) {
        repository
                .delete(sessionId)
                .subscribe()
                .with(
                        v -> LOG.debugf("Cleaned up expired session: %s", sessionId),
                        e -> LOG.warnf("Failed to clean up session: %s", e.getMessage()));
    }

    @Override
    public Uni<Void> revoke(String sessionId) {
        LOG.infof("Revoking session: %s", sessionId);
        return repository.delete(sessionId).replaceWithVoid();
    }

    @Override
    public Uni<Integer> revokeAll(String identity) {
        LOG.infof("Revoking all sessions for %s", identity);
        return repository.deleteByIdentity(identity);
    }

    @Override
    public Uni<Void> logout(SessionClaims claims, ClientInfo client) {
        return revoke(claims.sessionId())
                .call(() -> auditLogger.record(AuditEvent.builder(AuditEventType.AUTHENTICATION, AuditActions.LOGOUT)
                        .identity(claims.identity())
                        .originAddress(client.originAddress())
                        .userAgent(client.userAgent())
                        .success(true)
                        .metadata(Map.of("sessionId", claims.sessionId()))
                        .build()));
    }

    @Override
    public Uni<Integer> revokeAll(String identity, String actor) {
        return revokeAll(identity)
                .call(count -> auditLogger.record(
                        AuditEvent.builder(AuditEventType.SYSTEM_ACCESS, AuditActions.SESSIONS_REVOKED)
                                .identity(identity)
                                .success(true)
                                .metadata(Map.of("actor", actor != null ? actor : "unknown", "revoked", count))
                                .build()));
    }
}
