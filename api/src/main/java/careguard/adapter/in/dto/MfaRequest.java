package careguard.adapter.in.dto;

/**
 * Second factor presented to {@code POST /auth/mfa}.
 *
 * @param challengeToken token returned by the login step
 * @param code           current TOTP code
 */
public record MfaRequest(String challengeToken, String code) {}
