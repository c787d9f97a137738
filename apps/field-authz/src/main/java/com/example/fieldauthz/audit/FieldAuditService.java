package com.example.fieldauthz.audit;

import com.example.fieldauthz.common.util.StringSanitizer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;

/**
 * Writes field authorization decisions as structured JSON to a dedicated logger.
 */
@RequiredArgsConstructor
public class FieldAuditService {

    public static final String AUDIT_LOGGER = "FIELD_AUTHZ_AUDIT";

    private static final Logger AUDIT_LOG = LoggerFactory.getLogger(AUDIT_LOGGER);

    private final ObjectMapper objectMapper;

    public void logDecision(@NonNull FieldAuditEvent event) {
        try {
            String json = objectMapper.writeValueAsString(event.toStructuredLog());
            logByOutcome(event.outcome(), json);
        } catch (JsonProcessingException e) {
            AUDIT_LOG.error("Failed to serialize audit event: {}", StringSanitizer.forLog(e.getMessage()));
            logFallback(event);
        }
    }

    private void logByOutcome(@NonNull FieldAuditEvent.Outcome outcome, String json) {
        switch (outcome) {
            case ALLOW -> AUDIT_LOG.info(json);
            case DENY -> AUDIT_LOG.warn(json);
            case ERROR -> AUDIT_LOG.error(json);
        }
    }

    private void logFallback(@NonNull FieldAuditEvent event) {
        AUDIT_LOG.warn("FieldAuthZ {} - actor={}, field={}.{}, action={}, source={}, reason={}",
                event.outcome(),
                StringSanitizer.forLog(event.actor()),
                StringSanitizer.forLog(event.recordType()),
                StringSanitizer.forLog(event.field()),
                StringSanitizer.forLog(event.action()),
                event.source(),
                StringSanitizer.forLog(event.reason()));
    }
}
