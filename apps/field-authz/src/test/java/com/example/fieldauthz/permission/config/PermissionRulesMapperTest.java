package com.example.fieldauthz.permission.config;

import com.example.fieldauthz.config.FieldAuthzProperties.GrantDefinition;
import com.example.fieldauthz.config.FieldAuthzProperties.RecordTypeDefinition;
import com.example.fieldauthz.config.FieldAuthzProperties.RoleDefinition;
import com.example.fieldauthz.exception.InvalidPermissionRuleException;
import com.example.fieldauthz.permission.model.FieldSet;
import com.example.fieldauthz.permission.rule.RoleShorthand;
import com.example.fieldauthz.permission.rule.Rule;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionRulesMapper")
class PermissionRulesMapperTest {

    @Test
    @DisplayName("should map public fields, actions and grants in order")
    void shouldMapDefinition() {
        Map<String, RoleDefinition> roles = new LinkedHashMap<>();
        roles.put("self", new RoleDefinition(false, List.of("read"),
                List.of(new GrantDefinition(List.of("update"), List.of("username"))), null));
        roles.put("admin", new RoleDefinition(true, null, null, null));
        RecordTypeDefinition definition = new RecordTypeDefinition(List.of("id", "username"), null,
                Map.of("read", List.of("id")), roles);

        Map<String, RoleShorthand> shorthand = PermissionRulesMapper.toShorthand(definition);

        assertThat(shorthand).containsOnlyKeys("read", "self", "admin");
        assertThat(shorthand.get("read")).isEqualTo(RoleShorthand.publicFields("id"));
        assertThat(shorthand.get("self")).isEqualTo(RoleShorthand.rules(
                Rule.action("read"), Rule.grant("update", List.of("username"))));
        assertThat(shorthand.get("admin")).isSameAs(RoleShorthand.wildcard());
    }

    @Test
    @DisplayName("should map an expanded table with the wildcard token")
    void shouldMapExpandedTable() {
        RoleShorthand shorthand = PermissionRulesMapper.toShorthand("auditor",
                new RoleDefinition(false, null, null, Map.of("read", List.of("*"))));

        assertThat(shorthand).isEqualTo(RoleShorthand.expanded(Map.of("read", FieldSet.all())));
    }

    @Test
    @DisplayName("should reject mixing styles in one role")
    void shouldRejectMixedStyles() {
        assertThatThrownBy(() -> PermissionRulesMapper.toShorthand("admin",
                new RoleDefinition(true, List.of("read"), null, null)))
                .isInstanceOf(InvalidPermissionRuleException.class);
        assertThatThrownBy(() -> PermissionRulesMapper.toShorthand("auditor",
                new RoleDefinition(false, List.of("read"), null, Map.of("read", List.of("id")))))
                .isInstanceOf(InvalidPermissionRuleException.class);
    }

    @Test
    @DisplayName("should reject a grant without actions")
    void shouldRejectGrantWithoutActions() {
        assertThatThrownBy(() -> PermissionRulesMapper.toShorthand("self",
                new RoleDefinition(false, null, List.of(new GrantDefinition(null, List.of("id"))), null)))
                .isInstanceOf(InvalidPermissionRuleException.class)
                .hasMessageContaining("at least one action");
    }
}
