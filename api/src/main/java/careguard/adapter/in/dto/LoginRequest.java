package careguard.adapter.in.dto;

/**
 * Credentials presented to {@code POST /auth/login}.
 *
 * @param identity email address (case-insensitive)
 * @param secret   password
 */
public record LoginRequest(String identity, String secret) {

    @Override
    public String toString() {
        return "LoginRequest[identity=" + identity + ", secret=***]";
    }
}
