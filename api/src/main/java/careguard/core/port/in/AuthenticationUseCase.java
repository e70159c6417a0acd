package careguard.core.port.in;

import io.smallrye.mutiny.Uni;

import careguard.core.model.auth.AuthenticationResult;
import careguard.core.model.auth.ClientInfo;

/**
 * Inbound port for credential authentication.
 */
public interface AuthenticationUseCase {

    /**
     * Authenticate an identity with its secret.
     *
     * <p>The attempt passes rate limiting, lockout, credential verification and
     * then either session issuance or failure accounting. Every outcome is audited.
     *
     * @param identity submitted identity (email)
     * @param secret   submitted secret
     * @param client   request origin
     * @return the outcome; failures are reported as {@link AuthenticationResult.Denied}
     */
    Uni<AuthenticationResult> authenticate(String identity, String secret, ClientInfo client);

    default Uni<AuthenticationResult> authenticate(String identity, String secret, String originAddress) {
        return authenticate(identity, secret, ClientInfo.of(originAddress));
    }

    /**
     * Complete a pending MFA challenge.
     *
     * @param challengeToken token returned with {@link AuthenticationResult.MfaRequired}
     * @param code           one-time code
     * @param client         request origin
     * @return granted with a session, or denied with {@code MFA_FAILED}
     */
    Uni<AuthenticationResult> completeMfa(String challengeToken, String code, ClientInfo client);
}
