package com.example.fieldauthz.audit;

import com.example.fieldauthz.engine.DecisionSource;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("FieldAuditService")
class FieldAuditServiceTest {

    @Mock
    private ObjectMapper objectMapper;

    private static FieldAuditEvent denial() {
        return FieldAuditEvent.of(FieldAuditEvent.Outcome.DENY, DecisionSource.DEFAULT, null,
                "no role grants read", "NOT_FOUND", "anonymous", Set.of("public"), "user", "ssn", "read");
    }

    @Test
    @DisplayName("should flatten the event with empty strings for missing values")
    void shouldFlattenEvent() {
        Map<String, Object> log = denial().toStructuredLog();

        assertThat(log)
                .containsEntry("event_type", "field_authz_decision")
                .containsEntry("outcome", "DENY")
                .containsEntry("decided_by", "")
                .containsEntry("error_kind", "NOT_FOUND")
                .containsEntry("record_type", "user")
                .containsEntry("field", "ssn");
    }

    @Test
    @DisplayName("should serialize the structured event")
    void shouldSerializeEvent() throws JsonProcessingException {
        when(objectMapper.writeValueAsString(any())).thenReturn("{}");

        new FieldAuditService(objectMapper).logDecision(denial());

        verify(objectMapper).writeValueAsString(any());
    }

    @Test
    @DisplayName("should fall back to plain logging when serialization fails")
    void shouldFallBackWhenSerializationFails() throws JsonProcessingException {
        when(objectMapper.writeValueAsString(any())).thenThrow(new JsonProcessingException("bad") {});

        assertThatCode(() -> new FieldAuditService(objectMapper).logDecision(denial()))
                .doesNotThrowAnyException();
    }
}
