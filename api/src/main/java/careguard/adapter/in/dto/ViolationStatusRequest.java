package careguard.adapter.in.dto;

/**
 * Target status for a violation review step.
 */
public record ViolationStatusRequest(String status) {}
