package careguard.adapter.in.dto;

import java.time.Instant;

/**
 * Failure state of an account.
 *
 * @param identity       account identity
 * @param failedAttempts consecutive failed verifications
 * @param locked         whether a lock is currently active
 * @param lockExpiry     when the lock ends (null if none)
 */
public record LockoutStatusDto(String identity, int failedAttempts, boolean locked, Instant lockExpiry) {}
