package com.example.fieldauthz.audit;

import com.example.fieldauthz.engine.DecisionSource;

import java.time.Instant;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Structured audit event for a field authorization decision.
 */
public record FieldAuditEvent(
        // Event metadata
        String eventId,
        Instant timestamp,

        // Decision
        Outcome outcome,
        DecisionSource source,
        String decidedBy,
        String reason,
        String errorKind,

        // Subject
        String actor,
        Set<String> roles,

        // Target
        String recordType,
        String field,
        String action
) {
    public enum Outcome {
        ALLOW, DENY, ERROR
    }

    public static FieldAuditEvent of(
            Outcome outcome,
            DecisionSource source,
            String decidedBy,
            String reason,
            String errorKind,
            String actor,
            Set<String> roles,
            String recordType,
            String field,
            String action) {

        return new FieldAuditEvent(
                UUID.randomUUID().toString(),
                Instant.now(),
                outcome,
                source,
                decidedBy,
                reason,
                errorKind,
                actor,
                roles != null ? roles : Set.of(),
                recordType,
                field,
                action
        );
    }

    /**
     * Converts the event to a flat map for JSON logging.
     */
    public Map<String, Object> toStructuredLog() {
        return Map.ofEntries(
                Map.entry("event_type", "field_authz_decision"),
                Map.entry("event_id", eventId),
                Map.entry("timestamp", timestamp.toString()),
                Map.entry("outcome", outcome.name()),
                Map.entry("source", source != null ? source.name() : ""),
                Map.entry("decided_by", decidedBy != null ? decidedBy : ""),
                Map.entry("reason", reason != null ? reason : ""),
                Map.entry("error_kind", errorKind != null ? errorKind : ""),
                Map.entry("actor", actor != null ? actor : ""),
                Map.entry("roles", roles),
                Map.entry("record_type", recordType != null ? recordType : ""),
                Map.entry("field", field != null ? field : ""),
                Map.entry("action", action != null ? action : "")
        );
    }
}
