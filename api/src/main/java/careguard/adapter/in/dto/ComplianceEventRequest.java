package careguard.adapter.in.dto;

import java.time.Instant;
import java.util.Map;

/**
 * Audit event submitted by another service for recording and analysis.
 *
 * @param type         event category name, e.g. {@code DATA_ACCESS}
 * @param identity     acting identity
 * @param resourceType accessed resource type (optional)
 * @param resourceId   accessed resource id (optional)
 * @param action       action name
 * @param originAddress network origin (optional)
 * @param userAgent    client agent (optional)
 * @param timestamp    event time (defaults to now)
 * @param success      outcome
 * @param metadata     free-form details
 */
public record ComplianceEventRequest(
        String type,
        String identity,
        String resourceType,
        String resourceId,
        String action,
        String originAddress,
        String userAgent,
        Instant timestamp,
        Boolean success,
        Map<String, Object> metadata) {}
