package careguard.adapter.in.http;

import java.util.UUID;
import java.util.regex.Pattern;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.ws.rs.container.ContainerRequestContext;
import jakarta.ws.rs.container.ContainerResponseContext;

import org.jboss.logging.MDC;
import org.jboss.resteasy.reactive.server.ServerRequestFilter;
import org.jboss.resteasy.reactive.server.ServerResponseFilter;

/**
 * Assigns or propagates the {@code X-Request-ID} correlation id.
 *
 * <p>The id is placed in the logging MDC under {@code requestId} for the
 * duration of the request and echoed on every response. Caller-supplied ids
 * that are too long or contain unexpected characters are replaced.
 */
@ApplicationScoped
public class RequestIdFilter {

    public static final String HEADER = "X-Request-ID";
    public static final String MDC_KEY = "requestId";

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9._-]{1,64}");

    @ServerRequestFilter(preMatching = true)
    public void assignRequestId(ContainerRequestContext request) {
        final var supplied = request.getHeaderString(HEADER);
        final var requestId = isAcceptable(supplied) ? supplied : UUID.randomUUID().toString();
        request.setProperty(MDC_KEY, requestId);
        MDC.put(MDC_KEY, requestId);
    }

    @ServerResponseFilter
    public void echoRequestId(ContainerRequestContext request, ContainerResponseContext response) {
        final var requestId = request.getProperty(MDC_KEY);
        if (requestId != null) {
            response.getHeaders().putSingle(HEADER, requestId);
        }
        MDC.remove(MDC_KEY);
    }

    static boolean isAcceptable(String requestId) {
        return requestId != null && VALID_ID.matcher(requestId).matches();
    }
}
