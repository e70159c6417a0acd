package careguard.core.service.session;

import java.security.SecureRandom;
import java.util.Base64;

import jakarta.enterprise.context.ApplicationScoped;

/**
 * Generates session identifiers.
 *
 * <p>Identifiers are 32 random bytes from {@link SecureRandom}, URL-safe Base64
 * encoded without padding (43 characters).
 */
@ApplicationScoped
public class SessionIdGenerator {

    private static final int ID_BYTES = 32;
    private static final SecureRandom RANDOM = new SecureRandom();
    private static final Base64.Encoder ENCODER = Base64.getUrlEncoder().withoutPadding();

    public String generate() {
        final var bytes = new byte[ID_BYTES];
        RANDOM.nextBytes(bytes);
        return ENCODER.encodeToString(bytes);
    }
}
