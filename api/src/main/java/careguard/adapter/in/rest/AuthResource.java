package careguard.adapter.in.rest;

import java.util.Map;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.Consumes;
import jakarta.ws.rs.HeaderParam;
import jakarta.ws.rs.POST;
import jakarta.ws.rs.Path;
import jakarta.ws.rs.Produces;
import jakarta.ws.rs.core.Context;
import jakarta.ws.rs.core.HttpHeaders;
import jakarta.ws.rs.core.MediaType;
import jakarta.ws.rs.core.Response;

import io.smallrye.mutiny.Uni;
import io.vertx.core.http.HttpServerRequest;
import org.jboss.logging.Logger;

import careguard.adapter.in.dto.AuthorizeRequest;
import careguard.adapter.in.dto.LoginRequest;
import careguard.adapter.in.dto.LoginResponse;
import careguard.adapter.in.dto.MfaRequest;
import careguard.adapter.in.problem.AuthProblem;
import careguard.core.model.auth.AuthenticationResult;
import careguard.core.port.in.AuthenticationUseCase;
import careguard.core.port.in.AuthorizationUseCase;
import careguard.core.port.in.SessionManagement;

/**
 * Login, MFA completion, permission checks and logout.
 *
 * <p>Denied logins become problem responses: 401 for bad credentials or
 * failed MFA, 423 for a locked account, 429 when rate limited and 503 when a
 * backing store is unavailable.
 */
@Path("/auth")
@ApplicationScoped
@Produces(MediaType.APPLICATION_JSON)
@Consumes(MediaType.APPLICATION_JSON)
public class AuthResource {

    private static final Logger LOG = Logger.getLogger(AuthResource.class);

    private final AuthenticationUseCase authentication;
    private final AuthorizationUseCase authorization;
    private final SessionManagement sessions;
    private final BearerSessions bearerSessions;

    public AuthResource(
            AuthenticationUseCase authentication,
            AuthorizationUseCase authorization,
            SessionManagement sessions,
            BearerSessions bearerSessions) {
        this.authentication = authentication;
        this.authorization = authorization;
        this.sessions = sessions;
        this.bearerSessions = bearerSessions;
    }

    @POST
    @Path("/login")
    public Uni<Response> login(LoginRequest request, @Context HttpServerRequest httpRequest) {
        if (request == null || request.identity() == null || request.secret() == null) {
            throw AuthProblem.badRequest("identity and secret are required");
        }
        final var client = ClientInfoResolver.resolve(httpRequest);
        return authentication
                .authenticate(request.identity(), request.secret(), client)
                .map(AuthResource::toResponse);
    }

    @POST
    @Path("/mfa")
    public Uni<Response> completeMfa(MfaRequest request, @Context HttpServerRequest httpRequest) {
        if (request == null || request.challengeToken() == null || request.code() == null) {
            throw AuthProblem.badRequest("challengeToken and code are required");
        }
        final var client = ClientInfoResolver.resolve(httpRequest);
        return authentication
                .completeMfa(request.challengeToken(), request.code(), client)
                .map(AuthResource::toResponse);
    }

    @POST
    @Path("/authorize")
    public Uni<Response> authorize(
            AuthorizeRequest request,
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        if (request == null || request.resource() == null || request.action() == null) {
            throw AuthProblem.badRequest("resource and action are required");
        }
        final var client = ClientInfoResolver.resolve(httpRequest);
        return bearerSessions
                .require(authorizationHeader)
                .flatMap(claims -> authorization.authorize(claims, request.resource(), request.action(), client))
                .map(granted -> Response.ok(Map.of("granted", granted)).build());
    }

    @POST
    @Path("/logout")
    public Uni<Response> logout(
            @HeaderParam(HttpHeaders.AUTHORIZATION) String authorizationHeader,
            @Context HttpServerRequest httpRequest) {
        final var client = ClientInfoResolver.resolve(httpRequest);
        return bearerSessions
                .require(authorizationHeader)
                .call(claims -> sessions.logout(claims, client))
                .map(claims -> Response.noContent().build());
    }

    static Response toResponse(AuthenticationResult result) {
        if (result instanceof AuthenticationResult.Granted granted) {
            return Response.ok(LoginResponse.session(granted.token(), granted.expiresAt()))
                    .build();
        }
        if (result instanceof AuthenticationResult.MfaRequired mfa) {
            return Response.accepted(LoginResponse.challenge(mfa.challengeToken(), mfa.expiresAt()))
                    .build();
        }
        final var denied = (AuthenticationResult.Denied) result;
        LOG.debugf("Authentication denied: %s", denied.failure());
        throw AuthProblem.of(denied.failure(), denied.retryAfterSeconds());
    }
}
