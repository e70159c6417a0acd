package careguard.core.port.out;

/**
 * A backing store failed or did not answer within its bounded timeout.
 *
 * <p>Thrown by storage adapters. Rate-limit and lockout paths fail closed on
 * it; the audit path logs it and carries on unless audit writes are blocking.
 */
public class StoreUnavailableException extends RuntimeException {

    private final String store;
    private final String operation;

    public StoreUnavailableException(String store, String operation, Throwable cause) {
        super("Store unavailable: " + operation + " in " + store, cause);
        this.store = store;
        this.operation = operation;
    }

    public StoreUnavailableException(String store, String operation) {
        this(store, operation, null);
    }

    public String getStore() {
        return store;
    }

    public String getOperation() {
        return operation;
    }
}
