package careguard.adapter.in.rest;

import io.vertx.core.http.HttpServerRequest;

import careguard.core.model.auth.ClientInfo;

/**
 * Derives the request origin from forwarding headers or the socket address.
 */
final class ClientInfoResolver {

    static final String FORWARDED_FOR = "X-Forwarded-For";
    static final String USER_AGENT = "User-Agent";

    private ClientInfoResolver() {}

    static ClientInfo resolve(HttpServerRequest request) {
        if (request == null) {
            return ClientInfo.of(null);
        }
        return new ClientInfo(originOf(request.getHeader(FORWARDED_FOR), remoteHost(request)),
                request.getHeader(USER_AGENT));
    }

    /**
     * First hop of {@code X-Forwarded-For}, else the socket address.
     */
    static String originOf(String forwardedFor, String remoteHost) {
        if (forwardedFor != null && !forwardedFor.isBlank()) {
            final var first = forwardedFor.split(",")[0].trim();
            if (!first.isEmpty()) {
                return first;
            }
        }
        return remoteHost;
    }

    private static String remoteHost(HttpServerRequest request) {
        final var address = request.remoteAddress();
        return address != null ? address.host() : null;
    }
}
