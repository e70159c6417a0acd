package careguard.core.model.session;

/**
 * Result of validating a bearer token against its signature, its own expiry
 * and the session store.
 *
 * <p>{@link Expired} and {@link Invalid} are kept apart for logging and
 * auditing only; callers see the same message for both.
 */
public sealed interface SessionValidationResult {

    record Valid(SessionClaims claims) implements SessionValidationResult {}

    record Expired(String reason) implements SessionValidationResult {}

    record Invalid(String reason) implements SessionValidationResult {}

    default boolean isValid() {
        return this instanceof Valid;
    }
}
