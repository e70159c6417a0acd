package careguard.core.model.session;

/**
 * A freshly persisted session together with the bearer token handed to the caller.
 */
public record IssuedSession(Session session, String token) {}
