package careguard.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.PathParam;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;

import careguard.core.model.account.Account;
import careguard.core.port.in.SessionManagement;

/**
 * Revokes every session of an identity ("log out everywhere").
 *
 * <p>Requires {@code sessions:write}.
 */
@Path("/admin/sessions")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class SessionAdminResource {

    private final SessionManagement sessions;
    private final BearerSessions bearerSessions;

    public SessionAdminResource(SessionManagement sessions, BearerSessions bearerSessions) {
        this.sessions = sessions;
        this.bearerSessions = bearerSessions;
    }

    @DELETE
    @Path("/{identity}")
    public Uni<Response> revokeAll(
            @PathParam("identity") String identity,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        final var normalized = Account.normalize(identity);
        return bearerSessions
                .requirePermission(
                        authorizationHeader, "sessions", "write", ClientInfoResolver.resolve(httpRequest))
                .flatMap(claims -> sessions.revokeAll(normalized, claims.identity()))
                .map(count -> Response.ok(Map.of("identity", normalized, "revoked", count))
                        .build());
    }
}
