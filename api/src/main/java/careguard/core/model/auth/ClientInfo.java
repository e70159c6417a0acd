package careguard.core.model.auth;

/**
 * Request origin details carried into audit events.
 *
 * @param originAddress network origin (client IP)
 * @param userAgent     client agent string, may be null
 */
public record ClientInfo(String originAddress, String userAgent) {

    public static final String UNKNOWN_ORIGIN = "unknown";

    public ClientInfo {
        if (originAddress == null || originAddress.isBlank()) {
            originAddress = UNKNOWN_ORIGIN;
        }
    }

    public static boolean isKnownOrigin(String originAddress) {
        return originAddress != null && !originAddress.isBlank() && !UNKNOWN_ORIGIN.equals(originAddress);
    }

    public static ClientInfo of(String originAddress) {
        return new ClientInfo(originAddress, null);
    }
}
