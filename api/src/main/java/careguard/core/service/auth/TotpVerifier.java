package careguard.core.service.auth;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.MessageDigest;
import java.time.Instant;

import javax.crypto.Mac;
import javax.crypto.spec.SecretKeySpec;

import jakarta.enterprise.context.ApplicationScoped;

import org.apache.commons.codec.binary.Base32;

import careguard.core.config.MfaConfig;

/**
 * RFC 6238 time-based one-time password verification (HMAC-SHA1).
 *
 * <p>Codes from the current step and {@code allowedDriftSteps} steps either
 * side are accepted. Comparison is constant time.
 */
@ApplicationScoped
public class TotpVerifier {

    private static final String ALGORITHM = "HmacSHA1";
    private static final int[] POWERS = {1, 10, 100, 1_000, 10_000, 100_000, 1_000_000, 10_000_000, 100_000_000};

    private final MfaConfig config;
    private final Base32 base32 = new Base32();

    public TotpVerifier(MfaConfig config) {
        this.config = config;
    }

    /**
     * Verify a submitted code.
     *
     * @param base32Secret account TOTP secret
     * @param code         submitted code
     * @param at           verification time
     * @return true if the code matches a step inside the drift window
     */
    public boolean verify(String base32Secret, String code, Instant at) {
        if (base32Secret == null || code == null || code.length() != config.codeDigits()) {
            return false;
        }
        final var submitted = code.getBytes(StandardCharsets.US_ASCII);
        final var step = currentStep(at);
        var matched = false;
        for (var drift = -config.allowedDriftSteps(); drift <= config.allowedDriftSteps(); drift++) {
            final var expected = generate(base32Secret, step + drift).getBytes(StandardCharsets.US_ASCII);
            matched |= MessageDigest.isEqual(expected, submitted);
        }
        return matched;
    }

    /**
     * Code for the step containing {@code at}.
     */
    public String codeAt(String base32Secret, Instant at) {
        return generate(base32Secret, currentStep(at));
    }

    private long currentStep(Instant at) {
        return at.getEpochSecond() / config.timeStep().toSeconds();
    }

    private String generate(String base32Secret, long step) {
        final var key = base32.decode(base32Secret);
        final var counter = ByteBuffer.allocate(8).putLong(step).array();
        final byte[] hash;
        try {
            final var mac = Mac.getInstance(ALGORITHM);
            mac.init(new SecretKeySpec(key, ALGORITHM));
            hash = mac.doFinal(counter);
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException("HMAC-SHA1 unavailable for TOTP", e);
        }

        // Dynamic truncation, RFC 4226 section 5.3
        final var offset = hash[hash.length - 1] & 0x0F;
        final var binary = ((hash[offset] & 0x7F) << 24)
                | ((hash[offset + 1] & 0xFF) << 16)
                | ((hash[offset + 2] & 0xFF) << 8)
                | (hash[offset + 3] & 0xFF);

        final var digits = config.codeDigits();
        final var otp = binary % POWERS[digits];
        return String.format("%0" + digits + "d", otp);
    }
}
