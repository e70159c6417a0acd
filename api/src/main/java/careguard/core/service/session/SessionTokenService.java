package careguard.core.service.session;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;

import jakarta.enterprise.context.ApplicationScoped;

import org.jboss.logging.Logger;
import org.jose4j.jwa.AlgorithmConstraints;
import org.jose4j.jws.AlgorithmIdentifiers;
import org.jose4j.jws.JsonWebSignature;
import org.jose4j.jwt.JwtClaims;
import org.jose4j.jwt.MalformedClaimException;
import org.jose4j.jwt.NumericDate;
import org.jose4j.jwt.consumer.ErrorCodes;
import org.jose4j.jwt.consumer.InvalidJwtException;
import org.jose4j.jwt.consumer.JwtConsumer;
import org.jose4j.jwt.consumer.JwtConsumerBuilder;
import org.jose4j.jwt.consumer.JwtContext;
import org.jose4j.keys.HmacKey;
import org.jose4j.lang.JoseException;

import careguard.core.config.SessionConfig;
import careguard.core.model.session.SessionClaims;
import careguard.core.model.session.SessionValidationResult;

import static org.jose4j.jwa.AlgorithmConstraints.ConstraintType.PERMIT;

/**
 * Signs and verifies bearer tokens (HS256 JWS).
 *
 * <p>Two token kinds share the signing key and are told apart by the
 * {@code typ} claim: {@code session} tokens carry the full claim set, while
 * {@code mfa} challenge tokens only carry the subject and a short expiry. A
 * token of one kind is never accepted as the other.
 *
 * <p>Verification here is stateless. Whether the session is still registered
 * is checked separately by {@link SessionService}.
 */
@ApplicationScoped
public class SessionTokenService {

    private static final Logger LOG = Logger.getLogger(SessionTokenService.class);

    static final String TYPE_CLAIM = "typ";
    static final String SESSION_TYPE = "session";
    static final String MFA_TYPE = "mfa";
    static final String ROLE_CLAIM = "role";
    static final String PERMISSIONS_CLAIM = "permissions";
    static final String SESSION_ID_CLAIM = "sid";

    private static final int MIN_SECRET_BYTES = 32;

    private final SessionConfig config;
    private final Clock clock;
    private final HmacKey key;

    public SessionTokenService(SessionConfig config, Clock clock) {
        this.config = config;
        this.clock = clock;
        final var secret = config.token().signingSecret().getBytes(StandardCharsets.UTF_8);
        if (secret.length < MIN_SECRET_BYTES) {
            throw new IllegalStateException(
                    "careguard.session.token.signing-secret must be at least " + MIN_SECRET_BYTES + " bytes");
        }
        this.key = new HmacKey(secret);
    }

    /**
     * Sign a session token.
     *
     * @param claims claims to embed
     * @return compact JWS
     */
    public String sign(SessionClaims claims) {
        final var jwtClaims = baseClaims(claims.identity(), SESSION_TYPE, claims.issuedAt(), claims.expiresAt());
        jwtClaims.setClaim(ROLE_CLAIM, claims.role());
        jwtClaims.setStringListClaim(PERMISSIONS_CLAIM, new ArrayList<>(claims.permissions()));
        jwtClaims.setClaim(SESSION_ID_CLAIM, claims.sessionId());
        LOG.debugf("Signing session token for session %s, expires at %s", claims.sessionId(), claims.expiresAt());
        return serialize(jwtClaims);
    }

    /**
     * Sign a short-lived MFA challenge token for an identity.
     *
     * @param identity  identity whose password was verified
     * @param issuedAt  issuance time
     * @param expiresAt challenge expiry
     * @return compact JWS
     */
    public String signChallenge(String identity, Instant issuedAt, Instant expiresAt) {
        return serialize(baseClaims(identity, MFA_TYPE, issuedAt, expiresAt));
    }

    /**
     * Verify signature, issuer, type and expiry of a session token.
     *
     * @param token compact JWS
     * @return decoded claims, or expired/invalid with a reason
     */
    public SessionValidationResult verify(String token) {
        if (token == null || token.isBlank()) {
            return new SessionValidationResult.Invalid("missing_token");
        }
        try {
            final var context = consumer().process(token);
            final var claims = context.getJwtClaims();
            if (!SESSION_TYPE.equals(claims.getClaimValueAsString(TYPE_CLAIM))) {
                return new SessionValidationResult.Invalid("wrong_token_type");
            }
            return new SessionValidationResult.Valid(toSessionClaims(claims));
        } catch (InvalidJwtException e) {
            LOG.debugv("Session token rejected: {0}", e.getMessage());
            if (e.hasExpired()) {
                return new SessionValidationResult.Expired("token_expired");
            }
            return new SessionValidationResult.Invalid(summarizeJwtError(e));
        } catch (MalformedClaimException e) {
            LOG.debugv("Session token has malformed claims: {0}", e.getMessage());
            return new SessionValidationResult.Invalid("malformed_claims");
        }
    }

    /**
     * Verify an MFA challenge token.
     *
     * @param token compact JWS
     * @return outcome carrying the identity when valid
     */
    public ChallengeVerification verifyChallenge(String token) {
        if (token == null || token.isBlank()) {
            return ChallengeVerification.invalid("missing_token");
        }
        try {
            final var claims = consumer().process(token).getJwtClaims();
            if (!MFA_TYPE.equals(claims.getClaimValueAsString(TYPE_CLAIM))) {
                return ChallengeVerification.invalid("wrong_token_type");
            }
            return new ChallengeVerification(claims.getSubject(), false, null);
        } catch (InvalidJwtException e) {
            if (e.hasExpired()) {
                return new ChallengeVerification(subjectOf(e.getJwtContext()), true, "challenge_expired");
            }
            return ChallengeVerification.invalid(summarizeJwtError(e));
        } catch (MalformedClaimException e) {
            return ChallengeVerification.invalid("malformed_claims");
        }
    }

    private JwtClaims baseClaims(String subject, String type, Instant issuedAt, Instant expiresAt) {
        final var jwtClaims = new JwtClaims();
        jwtClaims.setIssuer(config.token().issuer());
        jwtClaims.setSubject(subject);
        jwtClaims.setIssuedAt(NumericDate.fromSeconds(issuedAt.getEpochSecond()));
        jwtClaims.setExpirationTime(NumericDate.fromSeconds(expiresAt.getEpochSecond()));
        jwtClaims.setClaim(TYPE_CLAIM, type);
        return jwtClaims;
    }

    private String serialize(JwtClaims claims) {
        final var jws = new JsonWebSignature();
        jws.setPayload(claims.toJson());
        jws.setKey(key);
        jws.setAlgorithmHeaderValue(AlgorithmIdentifiers.HMAC_SHA256);
        try {
            return jws.getCompactSerialization();
        } catch (JoseException e) {
            throw new TokenSigningException("Failed to sign token", e);
        }
    }

    private JwtConsumer consumer() {
        return new JwtConsumerBuilder()
                .setRequireSubject()
                .setRequireExpirationTime()
                .setRequireIssuedAt()
                .setExpectedIssuer(config.token().issuer())
                .setAllowedClockSkewInSeconds((int) config.token().clockSkew().toSeconds())
                .setEvaluationTime(NumericDate.fromSeconds(clock.instant().getEpochSecond()))
                .setVerificationKey(key)
                .setJwsAlgorithmConstraints(new AlgorithmConstraints(PERMIT, AlgorithmIdentifiers.HMAC_SHA256))
                .build();
    }

    private SessionClaims toSessionClaims(JwtClaims claims) throws MalformedClaimException {
        final List<String> permissions = claims.hasClaim(PERMISSIONS_CLAIM)
                ? claims.getStringListClaimValue(PERMISSIONS_CLAIM)
                : List.of();
        return new SessionClaims(
                claims.getSubject(),
                claims.getClaimValueAsString(ROLE_CLAIM),
                new HashSet<>(permissions),
                claims.getClaimValueAsString(SESSION_ID_CLAIM),
                Instant.ofEpochSecond(claims.getIssuedAt().getValue()),
                Instant.ofEpochSecond(claims.getExpirationTime().getValue()));
    }

    private static String subjectOf(JwtContext context) {
        if (context == null) {
            return null;
        }
        try {
            return context.getJwtClaims().getSubject();
        } catch (MalformedClaimException e) {
            return null;
        }
    }

    private static String summarizeJwtError(InvalidJwtException e) {
        if (e.hasErrorCode(ErrorCodes.SIGNATURE_INVALID)) {
            return "signature_invalid";
        }
        if (e.hasErrorCode(ErrorCodes.ISSUER_INVALID)) {
            return "issuer_invalid";
        }
        return "token_invalid";
    }

    /**
     * Outcome of verifying an MFA challenge token.
     *
     * @param identity identity from the token (null if unreadable)
     * @param expired  true if the challenge was well formed but has lapsed
     * @param reason   rejection reason (null when valid)
     */
    public record ChallengeVerification(String identity, boolean expired, String reason) {

        static ChallengeVerification invalid(String reason) {
            return new ChallengeVerification(null, false, reason);
        }

        public boolean valid() {
            return reason == null;
        }
    }

    public static class TokenSigningException extends RuntimeException {
        public TokenSigningException(String message, Throwable cause) {
            super(message, cause);
        }
    }
}
