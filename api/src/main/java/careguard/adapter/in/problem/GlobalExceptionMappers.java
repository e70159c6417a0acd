package careguard.adapter.in.problem;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.core.Response;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.Logger;
import org.jboss.resteasy.reactive.server.ServerExceptionMapper;

import careguard.core.port.out.StoreUnavailableException;
import careguard.core.service.session.SessionCreationException;

/**
 * Global exception mappers for converting exceptions to RFC 7807 Problem Details.
 *
 * <p>Nothing internal leaks: store names, stack traces and exception messages
 * stay in the log.
 */
@ApplicationScoped
public class GlobalExceptionMappers {

    private static final Logger LOG = Logger.getLogger(GlobalExceptionMappers.class);
    private static final String PROBLEM_JSON = "application/problem+json";

    static final String INVALID_REQUEST = "The request is invalid";
    static final String STATE_CONFLICT = "The request conflicts with the current state of the resource";

    @ServerExceptionMapper
    public Response mapStoreUnavailable(StoreUnavailableException e) {
        LOG.errorv("Backing store unavailable: {0}", e.getMessage());
        return toResponse(AuthProblem.storeUnavailable());
    }

    @ServerExceptionMapper
    public Response mapSessionCreation(SessionCreationException e) {
        LOG.errorv("Session creation failed: {0}", e.getMessage());
        return toResponse(AuthProblem.internalError());
    }

    @ServerExceptionMapper
    public Response mapIllegalArgumentException(IllegalArgumentException e) {
        LOG.debugv("Validation error: {0}", e.getMessage());
        return toResponse(AuthProblem.badRequest(INVALID_REQUEST));
    }

    @ServerExceptionMapper
    public Response mapIllegalStateException(IllegalStateException e) {
        LOG.debugv("State error: {0}", e.getMessage());
        return toResponse(AuthProblem.conflict(STATE_CONFLICT));
    }

    private Response toResponse(HttpProblem problem) {
        return Response.status(problem.getStatus())
                .type(PROBLEM_JSON)
                .entity(problem)
                .build();
    }
}
