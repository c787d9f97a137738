package com.example.fieldauthz.permission.config;

import com.example.fieldauthz.config.FieldAuthzProperties.GrantDefinition;
import com.example.fieldauthz.config.FieldAuthzProperties.RecordTypeDefinition;
import com.example.fieldauthz.config.FieldAuthzProperties.RoleDefinition;
import com.example.fieldauthz.exception.InvalidPermissionRuleException;
import com.example.fieldauthz.permission.model.FieldSet;
import com.example.fieldauthz.permission.rule.Rule;
import com.example.fieldauthz.permission.rule.RoleShorthand;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns a record type declared in configuration into compiler shorthand.
 */
public final class PermissionRulesMapper {

    private PermissionRulesMapper() {
    }

    public static Map<String, RoleShorthand> toShorthand(RecordTypeDefinition definition) {
        Map<String, RoleShorthand> shorthand = new LinkedHashMap<>();
        definition.publicFields().forEach((action, fields) ->
                shorthand.put(action, RoleShorthand.publicFields(fields)));
        definition.roles().forEach((role, rules) -> shorthand.put(role, toShorthand(role, rules)));
        return shorthand;
    }

    static RoleShorthand toShorthand(String role, RoleDefinition definition) {
        boolean hasRules = !definition.actions().isEmpty() || !definition.grants().isEmpty();
        boolean hasExpanded = !definition.expanded().isEmpty();

        if (definition.all()) {
            if (hasRules || hasExpanded) {
                throw new InvalidPermissionRuleException(role, "'all' cannot be combined with other rules");
            }
            return RoleShorthand.wildcard();
        }

        if (hasExpanded) {
            if (hasRules) {
                throw new InvalidPermissionRuleException(role, "'expanded' cannot be combined with other rules");
            }
            Map<String, FieldSet> table = new LinkedHashMap<>();
            definition.expanded().forEach((action, fields) -> table.put(action, FieldSet.of(fields)));
            return RoleShorthand.expanded(table);
        }

        List<Rule> rules = new ArrayList<>();
        definition.actions().forEach(action -> rules.add(Rule.action(action)));
        for (GrantDefinition grant : definition.grants()) {
            if (grant.actions().isEmpty()) {
                throw new InvalidPermissionRuleException(role, "a grant needs at least one action");
            }
            rules.add(Rule.grant(grant.actions(), grant.fields()));
        }
        return RoleShorthand.rules(rules);
    }
}
