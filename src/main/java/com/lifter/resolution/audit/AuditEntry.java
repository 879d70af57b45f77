package com.lifter.resolution.audit;

import java.time.Instant;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Immutable record of an auditable decision.
 *
 * @param id            entry id
 * @param action        what happened
 * @param lifterId      the lifter concerned, null when none was persisted
 * @param correlationId the row the decision belongs to
 * @param details       free-form attributes (stable ids, tolerances, reasons)
 * @param timestamp     when the entry was recorded
 */
public record AuditEntry(
        String id,
        AuditAction action,
        Long lifterId,
        String correlationId,
        Map<String, Object> details,
        Instant timestamp
) {
    public AuditEntry {
        Objects.requireNonNull(id, "id is required");
        Objects.requireNonNull(action, "action is required");
        Objects.requireNonNull(timestamp, "timestamp is required");
        details = details != null ? Map.copyOf(details) : Map.of();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String id = UUID.randomUUID().toString();
        private AuditAction action;
        private Long lifterId;
        private String correlationId;
        private Map<String, Object> details;
        private Instant timestamp = Instant.now();

        public Builder action(AuditAction action) {
            this.action = action;
            return this;
        }

        public Builder lifterId(Long lifterId) {
            this.lifterId = lifterId;
            return this;
        }

        public Builder correlationId(String correlationId) {
            this.correlationId = correlationId;
            return this;
        }

        public Builder details(Map<String, Object> details) {
            this.details = details;
            return this;
        }

        public Builder timestamp(Instant timestamp) {
            this.timestamp = timestamp;
            return this;
        }

        public AuditEntry build() {
            return new AuditEntry(id, action, lifterId, correlationId, details, timestamp);
        }
    }
}
