package careguard.core.service.auth;

import jakarta.enterprise.context.ApplicationScoped;

import io.smallrye.mutiny.Uni;
import io.smallrye.mutiny.infrastructure.Infrastructure;
import org.jboss.logging.Logger;
import org.mindrot.jbcrypt.BCrypt;

import careguard.core.config.CredentialConfig;
import careguard.core.model.account.Account;

/**
 * Verifies submitted secrets against bcrypt hashes.
 *
 * <p>Unknown identities are checked against a placeholder hash of the same
 * cost so the response time does not reveal whether an account exists.
 */
@ApplicationScoped
public class CredentialVerifier {

    private static final Logger LOG = Logger.getLogger(CredentialVerifier.class);

    private final int cost;
    private final String dummyHash;

    public CredentialVerifier(CredentialConfig config) {
        this.cost = config.bcryptCost();
        this.dummyHash = BCrypt.hashpw("careguard-placeholder-secret", BCrypt.gensalt(cost));
    }

    /**
     * Verify a secret against an account, or against the placeholder hash when
     * the account is absent.
     *
     * @param account the account, or null if the identity is unknown
     * @param secret  submitted secret
     * @return true only if the account exists and the secret matches
     */
    public boolean verify(Account account, String secret) {
        final var candidate = secret != null ? secret : "";
        if (account == null || account.credentialHash() == null) {
            checkQuietly(candidate, dummyHash);
            return false;
        }
        return checkQuietly(candidate, account.credentialHash());
    }

    /**
     * {@link #verify} on a worker thread. bcrypt is deliberately slow and must
     * not run on the I/O thread.
     */
    public Uni<Boolean> verifyAsync(Account account, String secret) {
        return Uni.createFrom()
                .item(() -> verify(account, secret))
                .runSubscriptionOn(Infrastructure.getDefaultWorkerPool());
    }

    /**
     * Hash a secret with the configured cost. Used by directory seeding and tests.
     */
    public String hash(String secret) {
        return BCrypt.hashpw(secret, BCrypt.gensalt(cost));
    }

    private boolean checkQuietly(String candidate, String hash) {
        try {
            return BCrypt.checkpw(candidate, hash);
        } catch (IllegalArgumentException e) {
            // Malformed stored hash
            LOG.warnf("Stored credential hash could not be parsed: %s", e.getMessage());
            BCrypt.checkpw(candidate, dummyHash);
            return false;
        }
    }
}
