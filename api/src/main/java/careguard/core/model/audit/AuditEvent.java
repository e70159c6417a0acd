package careguard.core.model.audit;

import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.UUID;

/**
 * Immutable audit trail record.
 *
 * <p>Events are append-only. {@code retainUntil} is a compliance retention
 * marker set when the event is persisted, not a cache TTL.
 *
 * @param id           unique event id (used to make analysis idempotent)
 * @param type         event category
 * @param identity     acting identity (may be null for anonymous system access)
 * @param resourceId   accessed resource id (optional)
 * @param resourceType accessed resource type (optional)
 * @param action       action name, e.g. {@code AUTH_FAILED_LOGIN}
 * @param originAddress network origin of the request
 * @param userAgent    client agent string (optional)
 * @param timestamp    when the event happened
 * @param success      whether the action succeeded
 * @param riskLevel    assigned risk (null until assigned by the audit logger)
 * @param metadata     free-form details
 * @param retainUntil  end of the retention period (null until persisted)
 */
public record AuditEvent(
        String id,
        AuditEventType type,
        String identity,
        String resourceId,
        String resourceType,
        String action,
        String originAddress,
        String userAgent,
        Instant timestamp,
        boolean success,
        RiskLevel riskLevel,
        Map<String, Object> metadata,
        Instant retainUntil) {

    public AuditEvent {
        if (type == null) {
            throw new IllegalArgumentException("Audit event type cannot be null");
        }
        if (action == null || action.isBlank()) {
            throw new IllegalArgumentException("Audit event action cannot be null or blank");
        }
        if (id == null || id.isBlank()) {
            id = UUID.randomUUID().toString();
        }
        metadata = withoutNulls(metadata);
    }

    // Entries with a null key or value carry nothing and are dropped.
    private static Map<String, Object> withoutNulls(Map<String, Object> metadata) {
        if (metadata == null || metadata.isEmpty()) {
            return Map.of();
        }
        final var copy = new HashMap<String, Object>();
        metadata.forEach((key, value) -> {
            if (key != null && value != null) {
                copy.put(key, value);
            }
        });
        return Map.copyOf(copy);
    }

    public AuditEvent withIdentity(String identity) {
        return new AuditEvent(
                id, type, identity, resourceId, resourceType, action, originAddress, userAgent, timestamp, success,
                riskLevel, metadata, retainUntil);
    }

    public AuditEvent withRiskLevel(RiskLevel riskLevel) {
        return new AuditEvent(
                id, type, identity, resourceId, resourceType, action, originAddress, userAgent, timestamp, success,
                riskLevel, metadata, retainUntil);
    }

    public AuditEvent withTimestamp(Instant timestamp) {
        return new AuditEvent(
                id, type, identity, resourceId, resourceType, action, originAddress, userAgent, timestamp, success,
                riskLevel, metadata, retainUntil);
    }

    public AuditEvent withRetainUntil(Instant retainUntil) {
        return new AuditEvent(
                id, type, identity, resourceId, resourceType, action, originAddress, userAgent, timestamp, success,
                riskLevel, metadata, retainUntil);
    }

    /**
     * Creates a builder for an event of the given type and action.
     */
    public static Builder builder(AuditEventType type, String action) {
        return new Builder(type, action);
    }

    public static class Builder {
        private final AuditEventType type;
        private final String action;
        private String id;
        private String identity;
        private String resourceId;
        private String resourceType;
        private String originAddress;
        private String userAgent;
        private Instant timestamp;
        private boolean success;
        private RiskLevel riskLevel;
        private Map<String, Object> metadata = Map.of();

        private Builder(AuditEventType type, String action) {
            this.type = type;
            this.action = action;
        }

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder identity(String identity) {
            this.identity = identity;
            return this;
        }

        public Builder resource(String resourceType, String resourceId) {
            this.resourceType = resourceType;
            this.resourceId = resourceId;
            return this;
        }

        public Builder originAddress(String originAddress) {
            this.originAddress = originAddress;
            return this;
        }

        public Builder userAgent(String userAgent) {
            this.userAgent = userAgent;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public Builder success(boolean success) {
            this.success = success;
            return this;
        }

        public Builder riskLevel(RiskLevel riskLevel) {
            this.riskLevel = riskLevel;
            return this;
        }

        public Builder metadata(Map<String, Object> metadata) {
            this.metadata = metadata;
            return this;
        }

        public AuditEvent build() {
            return new AuditEvent(
                    id, type, identity, resourceId, resourceType, action, originAddress, userAgent, timestamp,
                    success, riskLevel, metadata, null);
        }
    }
}
