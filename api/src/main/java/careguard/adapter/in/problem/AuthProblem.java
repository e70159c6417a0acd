package careguard.adapter.in.problem;

import jakarta.ws.rs.core.Response.Status;
import jakarta.ws.rs.core.Response.StatusType;

import io.quarkiverse.resteasy.problem.HttpProblem;
import org.jboss.logging.MDC;

import careguard.adapter.in.http.RequestIdFilter;
import careguard.core.model.auth.AuthFailure;

/**
 * RFC 7807 Problem Details factory for CareGuard errors.
 *
 * <p>Details are the coarse caller messages of {@link AuthFailure}. Every
 * problem carries the request id so operators can correlate it with logs.
 */
public final class AuthProblem {

    /** HTTP 423, absent from {@link Status}. */
    static final StatusType LOCKED = new StatusType() {
        @Override
        public int getStatusCode() {
            return 423;
        }

        @Override
        public Status.Family getFamily() {
            return Status.Family.CLIENT_ERROR;
        }

        @Override
        public String getReasonPhrase() {
            return "Locked";
        }
    };

    private AuthProblem() {
        // Utility class - prevent instantiation
    }

    // ========== Authentication Errors ==========

    /**
     * Create the problem for a rejected authentication.
     *
     * @param failure           failure category
     * @param retryAfterSeconds retry hint (ignored when zero)
     * @return problem with the status matching the failure
     */
    public static HttpProblem of(AuthFailure failure, long retryAfterSeconds) {
        final var builder = base(titleFor(failure), statusFor(failure), failure.callerMessage());
        if (retryAfterSeconds > 0) {
            builder.with("retryAfter", retryAfterSeconds).withHeader("Retry-After", retryAfterSeconds);
        }
        return builder.build();
    }

    public static HttpProblem of(AuthFailure failure) {
        return of(failure, 0);
    }

    /**
     * Uniform problem for a missing, invalid, revoked or expired session.
     */
    public static HttpProblem invalidSession() {
        return of(AuthFailure.SESSION_INVALID);
    }

    public static HttpProblem forbidden() {
        return base("Forbidden", Status.FORBIDDEN, "Access denied").build();
    }

    // ========== Request Errors ==========

    public static HttpProblem badRequest(String detail) {
        return base("Bad Request", Status.BAD_REQUEST, detail).build();
    }

    public static HttpProblem notFound(String detail) {
        return base("Not Found", Status.NOT_FOUND, detail).build();
    }

    public static HttpProblem conflict(String detail) {
        return base("Conflict", Status.CONFLICT, detail).build();
    }

    // ========== Server Errors ==========

    public static HttpProblem storeUnavailable() {
        return of(AuthFailure.STORE_UNAVAILABLE);
    }

    public static HttpProblem internalError() {
        return base("Internal Server Error", Status.INTERNAL_SERVER_ERROR, "Unexpected error").build();
    }

    private static HttpProblem.Builder base(String title, StatusType status, String detail) {
        final var builder = HttpProblem.builder().withTitle(title).withStatus(status).withDetail(detail);
        final var requestId = MDC.get(RequestIdFilter.MDC_KEY);
        if (requestId != null) {
            builder.with("requestId", requestId.toString());
        }
        return builder;
    }

    static StatusType statusFor(AuthFailure failure) {
        return switch (failure) {
            case RATE_LIMITED -> Status.TOO_MANY_REQUESTS;
            case ACCOUNT_LOCKED -> LOCKED;
            case STORE_UNAVAILABLE -> Status.SERVICE_UNAVAILABLE;
            case INVALID_CREDENTIALS, MFA_REQUIRED, MFA_FAILED, SESSION_EXPIRED, SESSION_INVALID -> Status.UNAUTHORIZED;
        };
    }

    private static String titleFor(AuthFailure failure) {
        return switch (failure) {
            case RATE_LIMITED -> "Too Many Requests";
            case ACCOUNT_LOCKED -> "Locked";
            case STORE_UNAVAILABLE -> "Service Unavailable";
            default -> "Unauthorized";
        };
    }
}
