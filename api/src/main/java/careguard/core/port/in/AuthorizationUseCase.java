package careguard.core.port.in;

import io.smallrye.mutiny.Uni;

import careguard.core.model.auth.ClientInfo;
import careguard.core.model.session.SessionClaims;

/**
 * Inbound port for permission checks.
 */
public interface AuthorizationUseCase {

    /**
     * Decide whether the session may perform {@code action} on {@code resource}.
     *
     * <p>Every decision is audited.
     *
     * @param claims   validated session claims
     * @param resource resource name, e.g. {@code patients}
     * @param action   action name, e.g. {@code read}
     * @param client   request origin
     * @return true if granted
     */
    Uni<Boolean> authorize(SessionClaims claims, String resource, String action, ClientInfo client);

    default Uni<Boolean> authorize(SessionClaims claims, String resource, String action) {
        return authorize(claims, resource, action, ClientInfo.of(null));
    }
}
