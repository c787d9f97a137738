package com.example.fieldauthz.permission.rule;

import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.model.FieldSet;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;

/**
 * Fluent builder for the shorthand map consumed by the compiler.
 *
 * <pre>
 * PermissionRules.builder()
 *         .publicFields(Crud.READ, "id", "username")
 *         .role("self", r -&gt; r
 *                 .grant(List.of("create", "update"), "username", "fullname")
 *                 .action("read")
 *                 .action("delete"))
 *         .wildcard("admin")
 *         .build();
 * </pre>
 */
public final class PermissionRules {

    private final Map<String, RoleShorthand> rules = new LinkedHashMap<>();

    private PermissionRules() {
    }

    public static PermissionRules builder() {
        return new PermissionRules();
    }

    /**
     * Public fields for a built-in action ({@code read=[...]}).
     */
    public PermissionRules publicFields(Crud action, String... fields) {
        rules.put(action.action(), RoleShorthand.publicFields(fields));
        return this;
    }

    public PermissionRules role(String role, Consumer<RoleRules> configurer) {
        RoleRules roleRules = new RoleRules();
        configurer.accept(roleRules);
        rules.put(role, RoleShorthand.rules(roleRules.rules));
        return this;
    }

    public PermissionRules wildcard(String role) {
        rules.put(role, RoleShorthand.wildcard());
        return this;
    }

    public PermissionRules expanded(String role, Map<String, FieldSet> table) {
        rules.put(role, RoleShorthand.expanded(table));
        return this;
    }

    public Map<String, RoleShorthand> build() {
        return new LinkedHashMap<>(rules);
    }

    /**
     * Rule list of a single role.
     */
    public static final class RoleRules {

        private final List<Rule> rules = new ArrayList<>();

        private RoleRules() {
        }

        /**
         * Allows {@code action} on every field.
         */
        public RoleRules action(String action) {
            rules.add(Rule.action(action));
            return this;
        }

        public RoleRules grant(String action, String... fields) {
            rules.add(Rule.grant(action, List.of(fields)));
            return this;
        }

        public RoleRules grant(List<String> actions, String... fields) {
            rules.add(Rule.grant(actions, List.of(fields)));
            return this;
        }
    }
}
