package careguard.core.service.session;

/**
 * No unused session identifier could be found within the retry budget.
 */
public class SessionCreationException extends RuntimeException {

    public SessionCreationException(String message) {
        super(message);
    }
}
