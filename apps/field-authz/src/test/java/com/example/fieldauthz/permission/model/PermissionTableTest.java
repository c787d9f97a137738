package com.example.fieldauthz.permission.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionTable")
class PermissionTableTest {

    @Test
    @DisplayName("should treat a missing role or action as no fields")
    void shouldTreatMissingEntryAsNoFields() {
        PermissionTable table = PermissionTable.of(Map.of("self", Map.of("read", FieldSet.all())));

        assertThat(table.fieldsFor("self", "update")).isEqualTo(FieldSet.none());
        assertThat(table.fieldsFor("guest", "read")).isEqualTo(FieldSet.none());
        assertThat(table.hasEntry("self", "read")).isTrue();
        assertThat(table.hasEntry("self", "update")).isFalse();
    }

    @Test
    @DisplayName("should not change when the source map changes")
    void shouldBeImmutable() {
        Map<String, FieldSet> byAction = new HashMap<>();
        byAction.put("read", FieldSet.of("id"));
        Map<String, Map<String, FieldSet>> source = new HashMap<>();
        source.put("public", byAction);

        PermissionTable table = PermissionTable.of(source);
        byAction.put("update", FieldSet.all());

        assertThat(table.actions()).containsExactly("read");
        assertThatThrownBy(() -> table.asMap().put("admin", Map.of()))
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
