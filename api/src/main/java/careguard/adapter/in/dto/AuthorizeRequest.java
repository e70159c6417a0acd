package careguard.adapter.in.dto;

/**
 * Permission check request for {@code POST /auth/authorize}.
 */
public record AuthorizeRequest(String resource, String action) {}
