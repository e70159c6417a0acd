package careguard.adapter.in.dto;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Result of a successful login step.
 *
 * <p>Either a session ({@code granted}, {@code token}, {@code expiresAt}) or an
 * MFA challenge ({@code requiresMFA}, {@code challengeToken}, {@code expiresAt}).
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record LoginResponse(
        boolean granted, String token, Instant expiresAt, Boolean requiresMFA, String challengeToken) {

    public static LoginResponse session(String token, Instant expiresAt) {
        return new LoginResponse(true, token, expiresAt, null, null);
    }

    public static LoginResponse challenge(String challengeToken, Instant expiresAt) {
        return new LoginResponse(false, null, expiresAt, true, challengeToken);
    }
}
