package careguard.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.adapter.in.problem.AuthProblem;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.session.SessionClaims;
import careguard.core.model.session.SessionValidationResult;
import careguard.core.port.in.AuthorizationUseCase;
import careguard.core.port.in.SessionManagement;

/**
 * Resolves the {@code Authorization: Bearer} header of a request into session
 * claims, and optionally checks a permission for administrative endpoints.
 *
 * <p>Every session problem produces the same 401 so callers cannot tell an
 * expired session from a revoked or forged one.
 */
@ApplicationScoped
public class BearerSessions {

    private static final Logger LOG = Logger.getLogger(BearerSessions.class);
    private static final String BEARER_PREFIX = "Bearer ";

    private final SessionManagement sessions;
    private final AuthorizationUseCase authorization;

    public BearerSessions(SessionManagement sessions, AuthorizationUseCase authorization) {
        this.sessions = sessions;
        this.authorization = authorization;
    }

    /**
     * Validate the bearer token.
     *
     * @param authorizationHeader raw header value
     * @return claims, or a failed Uni carrying the 401 problem
     */
    public Uni<SessionClaims> require(String authorizationHeader) {
        final var token = extractToken(authorizationHeader);
        if (token == null) {
            return Uni.createFrom().failure(AuthProblem.invalidSession());
        }
        return sessions.validate(token).flatMap(result -> {
            if (result instanceof SessionValidationResult.Valid valid) {
                return Uni.createFrom().item(valid.claims());
            }
            if (result instanceof SessionValidationResult.Expired expired) {
                LOG.debugf("Rejected expired session: %s", expired.reason());
            } else if (result instanceof SessionValidationResult.Invalid invalid) {
                LOG.debugf("Rejected invalid session: %s", invalid.reason());
            }
            return Uni.createFrom().failure(AuthProblem.invalidSession());
        });
    }

    /**
     * Validate the bearer token and require a permission.
     *
     * @return claims, or a failed Uni carrying 401 or 403
     */
    public Uni<SessionClaims> requirePermission(
            String authorizationHeader, String resource, String action, ClientInfo client) {
        return require(authorizationHeader)
                .call(claims -> authorization.authorize(claims, resource, action, client).invoke(granted -> {
                    if (!granted) {
                        throw AuthProblem.forbidden();
                    }
                }));
    }

    static String extractToken(String authorizationHeader) {
        if (authorizationHeader == null || !authorizationHeader.regionMatches(true, 0, BEARER_PREFIX, 0, 7)) {
            return null;
        }
        final var token = authorizationHeader.substring(BEARER_PREFIX.length()).trim();
        return token.isEmpty() ? null : token;
    }
}
