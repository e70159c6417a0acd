package careguard.core.service.auth;

import java.util.List;
import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import org.jboss.logging.Logger;

import careguard.core.config.RoleConfig;
import careguard.core.model.audit.AuditActions;
import careguard.core.model.audit.AuditEvent;
import careguard.core.model.audit.AuditEventType;
import careguard.core.model.auth.ClientInfo;
import careguard.core.model.session.SessionClaims;
import careguard.core.port.in.AuthorizationUseCase;
import careguard.core.service.audit.AuditLogger;

/**
 * Permission checks against session claims and configured role permissions.
 *
 * <p>Every decision, granted or denied, is audited. Repeated denials feed the
 * compliance analyzer.
 */
@ApplicationScoped
public class AuthorizationService implements AuthorizationUseCase {

    private static final Logger LOG = Logger.getLogger(AuthorizationService.class);

    private final RoleConfig roleConfig;
    private final AuditLogger auditLogger;

    public AuthorizationService(RoleConfig roleConfig, AuditLogger auditLogger) {
        this.roleConfig = roleConfig;
        this.auditLogger = auditLogger;
    }

    @Override
    public Uni<Boolean> authorize(SessionClaims claims, String resource, String action, ClientInfo client) {
        final var granted = PermissionMatcher.matches(claims.permissions(), resource, action)
                || PermissionMatcher.matches(rolePermissions(claims.role()), resource, action);

        if (granted) {
            LOG.debugf("Access granted: %s %s:%s", claims.identity(), resource, action);
        } else {
            LOG.infof("Access denied: %s %s:%s (role %s)", claims.identity(), resource, action, claims.role());
        }

        final var event = AuditEvent.builder(AuditEventType.AUTHORIZATION, AuditActions.ACCESS_CHECK)
                .identity(claims.identity())
                .resource(resource, null)
                .originAddress(client.originAddress())
                .userAgent(client.userAgent())
                .success(granted)
                .metadata(Map.of(
                        "granted", granted,
                        "permission", PermissionMatcher.permission(resource, action),
                        "sessionId", claims.sessionId() != null ? claims.sessionId() : ""))
                .build();

        return auditLogger.record(event).replaceWith(granted);
    }

    List<String> rolePermissions(String role) {
        if (role == null) {
            return List.of();
        }
        final var configured = roleConfig.roles().get(role);
        return configured != null ? configured.permissions() : List.of();
    }
}
