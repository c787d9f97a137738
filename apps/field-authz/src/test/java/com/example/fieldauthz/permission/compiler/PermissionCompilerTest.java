package com.example.fieldauthz.permission.compiler;

import com.example.fieldauthz.exception.InvalidPermissionRuleException;
import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.model.FieldSet;
import com.example.fieldauthz.permission.model.PermissionTable;
import com.example.fieldauthz.permission.rule.PermissionRules;
import com.example.fieldauthz.permission.rule.RoleShorthand;
import com.example.fieldauthz.permission.rule.Rule;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("PermissionCompiler")
class PermissionCompilerTest {

    private PermissionCompiler compiler;

    @BeforeEach
    void setUp() {
        compiler = new PermissionCompiler();
    }

    @Nested
    @DisplayName("public sugar")
    class PublicSugar {

        @Test
        @DisplayName("should fold built-in action keys into the public role")
        void shouldFoldBuiltInKeysIntoPublicRole() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "id", "username")
                    .publicFields(Crud.CREATE, "username")
                    .build());

            assertThat(table.roles()).containsExactly("public");
            assertThat(table.fieldsFor("public", "read")).isEqualTo(FieldSet.of("id", "username"));
            assertThat(table.fieldsFor("public", "create")).isEqualTo(FieldSet.of("username"));
        }

        @Test
        @DisplayName("should merge an explicit public role over the sugar")
        void shouldMergeExplicitPublicRole() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "id")
                    .role("public", r -> r.grant("update", "nickname"))
                    .build());

            assertThat(table.fieldsFor("public", "read")).isEqualTo(FieldSet.of("id"));
            assertThat(table.fieldsFor("public", "update")).isEqualTo(FieldSet.of("nickname"));
        }

        @Test
        @DisplayName("should use the configured public role name")
        void shouldUseConfiguredPublicRole() {
            PermissionTable table = new PermissionCompiler("anyone").compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "id")
                    .build());

            assertThat(table.roles()).containsExactly("anyone");
        }
    }

    @Nested
    @DisplayName("role rules")
    class RoleRules {

        @Test
        @DisplayName("should expand bare actions to every field and grants to their fields")
        void shouldExpandBareActionsAndGrants() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "A", "B")
                    .role("self", r -> r
                            .action("read")
                            .action("delete")
                            .grant("update", "A"))
                    .build());

            assertThat(table.fieldsFor("self", "read")).isEqualTo(FieldSet.all());
            assertThat(table.fieldsFor("self", "delete")).isEqualTo(FieldSet.all());
            assertThat(table.fieldsFor("self", "update")).isEqualTo(FieldSet.of("A"));
            assertThat(table.fieldsFor("public", "read")).isEqualTo(FieldSet.of("A", "B"));
        }

        @Test
        @DisplayName("should add the public fields of the same action to a grant")
        void shouldInheritPublicFieldsInGrant() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "id", "username")
                    .role("friend", r -> r.grant("read", "fullname"))
                    .build());

            FieldSet read = table.fieldsFor("friend", "read");
            assertThat(read.contains("fullname")).isTrue();
            assertThat(read.contains("id")).isTrue();
            assertThat(read.contains("username")).isTrue();
            assertThat(read.contains("ssn")).isFalse();
        }

        @Test
        @DisplayName("should map every discovered action to all fields for a wildcard role")
        void shouldExpandWildcardOverDiscoveredActions() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .role("editor", r -> r.grant("publish", "title"))
                    .wildcard("admin")
                    .build());

            assertThat(table.entriesFor("admin"))
                    .containsOnlyKeys("create", "read", "update", "delete", "publish")
                    .allSatisfy((action, fields) -> assertThat(fields.isAll()).isTrue());
        }

        @Test
        @DisplayName("should expand a wildcard over the explicit actions only")
        void shouldExpandWildcardOverExplicitActions() {
            PermissionTable table = compiler.compile(
                    PermissionRules.builder().wildcard("admin").build(),
                    List.of("read", "approve"));

            assertThat(table.entriesFor("admin")).containsOnlyKeys("read", "approve");
        }

        @Test
        @DisplayName("should keep custom verbs as regular actions")
        void shouldKeepCustomVerbs() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .role("auditor", r -> r.action("export"))
                    .build());

            assertThat(table.grants("auditor", "export", "anything")).isTrue();
            assertThat(table.actions()).containsExactly("export");
        }

        @Test
        @DisplayName("should build separate field lists for every action of a grant")
        void shouldBuildSeparateFieldListsPerAction() {
            PermissionTable table = compiler.compile(PermissionRules.builder()
                    .publicFields(Crud.READ, "id")
                    .role("self", r -> r.grant(List.of("read", "update"), "username"))
                    .build());

            assertThat(table.fieldsFor("self", "read")).isEqualTo(FieldSet.of("username", "id"));
            assertThat(table.fieldsFor("self", "update")).isEqualTo(FieldSet.of("username"));
        }
    }

    @Nested
    @DisplayName("expanded tables")
    class ExpandedTables {

        @Test
        @DisplayName("should pass an already expanded table through unchanged")
        void shouldPassExpandedTableThrough() {
            Map<String, FieldSet> expanded = new LinkedHashMap<>();
            expanded.put("read", FieldSet.all());
            expanded.put("update", FieldSet.of("username"));

            PermissionTable first = compiler.compile(Map.of("self", RoleShorthand.expanded(expanded)));
            PermissionTable second = compiler.compile(Map.of("self", RoleShorthand.expanded(first.entriesFor("self"))));

            assertThat(first.entriesFor("self")).isEqualTo(expanded);
            assertThat(second).isEqualTo(first);
        }

        @Test
        @DisplayName("should discover the actions of an expanded table")
        void shouldDiscoverExpandedActions() {
            assertThat(compiler.discoverActions(List.of(
                    RoleShorthand.expanded(Map.of("archive", FieldSet.all())),
                    RoleShorthand.rules(Rule.action("export")))))
                    .containsExactly("create", "read", "update", "delete", "archive", "export");
        }
    }

    @Nested
    @DisplayName("invalid shorthand")
    class InvalidShorthand {

        @Test
        @DisplayName("should reject a rule list under a built-in action key")
        void shouldRejectRulesUnderBuiltInKey() {
            Map<String, RoleShorthand> rules = Map.of("read", RoleShorthand.wildcard());

            assertThatThrownBy(() -> compiler.compile(rules))
                    .isInstanceOf(InvalidPermissionRuleException.class)
                    .hasMessageContaining("'read'");
        }

        @Test
        @DisplayName("should reject a plain field list under a role")
        void shouldRejectFieldListUnderRole() {
            Map<String, RoleShorthand> rules = Map.of("self", RoleShorthand.publicFields("id"));

            assertThatThrownBy(() -> compiler.compile(rules))
                    .isInstanceOf(InvalidPermissionRuleException.class)
                    .satisfies(e -> assertThat(((InvalidPermissionRuleException) e).getRole()).isEqualTo("self"));
        }
    }
}
