package careguard.adapter.in.rest;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.DELETE;
import jakarta.ws.rs.GET;
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

import careguard.adapter.in.dto.LockoutStatusDto;
import careguard.adapter.in.problem.AuthProblem;
import careguard.core.model.account.Account;
import careguard.core.port.in.LockoutManagement;

/**
 * REST resource for account lockout administration.
 *
 * <p>Reading requires {@code lockouts:read}, clearing {@code lockouts:write}.
 */
@Path("/admin/lockouts")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
public class LockoutResource {

    private final LockoutManagement lockouts;
    private final BearerSessions bearerSessions;

    public LockoutResource(LockoutManagement lockouts, BearerSessions bearerSessions) {
        this.lockouts = lockouts;
        this.bearerSessions = bearerSessions;
    }

    /**
     * Get the failure count and lock expiry of an account.
     *
     * @param identity account identity
     * @return lockout status, or 404 if the account is unknown
     */
    @GET
    @Path("/{identity}")
    public Uni<Response> getLockoutStatus(
            @PathParam("identity") String identity,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        final var normalized = Account.normalize(identity);
        return bearerSessions
                .requirePermission(
                        authorizationHeader, "lockouts", "read", ClientInfoResolver.resolve(httpRequest))
                .flatMap(claims -> lockouts.lockoutStatus(normalized))
                .map(status -> status.map(s -> Response.ok(
                                        new LockoutStatusDto(normalized, s.failedAttempts(), s.locked(), s.lockExpiry()))
                                .build())
                        .orElseThrow(() -> AuthProblem.notFound("Account not found")));
    }

    /**
     * Clear the failure counter and any active lock.
     *
     * @param identity account identity
     * @return 204 No Content
     */
    @DELETE
    @Path("/{identity}")
    public Uni<Response> clearLockout(
            @PathParam("identity") String identity,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        return bearerSessions
                .requirePermission(
                        authorizationHeader, "lockouts", "write", ClientInfoResolver.resolve(httpRequest))
                .flatMap(claims -> lockouts.clearLockout(identity, claims.identity()))
                .map(ignored -> Response.noContent().build());
    }
}
