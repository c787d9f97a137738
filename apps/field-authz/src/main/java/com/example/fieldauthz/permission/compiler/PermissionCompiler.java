package com.example.fieldauthz.permission.compiler;

import com.example.fieldauthz.exception.InvalidPermissionRuleException;
import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.model.FieldSet;
import com.example.fieldauthz.permission.model.PermissionTable;
import com.example.fieldauthz.permission.rule.Rule;
import com.example.fieldauthz.permission.rule.RoleShorthand;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Expands role shorthand into a {@link PermissionTable}.
 *
 * <p>Compilation rules:
 * <ul>
 *   <li>A built-in action key holding a plain field list ({@code read=[...]}) becomes
 *       an entry of the public role.</li>
 *   <li>The action universe is the explicit action list when given, otherwise the
 *       CRUD actions plus every action named anywhere in the shorthand.</li>
 *   <li>A wildcard role gets every action of the universe on every field.</li>
 *   <li>A bare action grants that action on every field.</li>
 *   <li>A grant gives its actions on the listed fields plus the public role's fields
 *       for the same action.</li>
 *   <li>An already expanded table is copied as is.</li>
 * </ul>
 *
 * <p>Stateless: the same shorthand always compiles to the same table.
 */
@Slf4j
public class PermissionCompiler {

    public static final String DEFAULT_PUBLIC_ROLE = "public";

    private final String publicRole;

    public PermissionCompiler() {
        this(DEFAULT_PUBLIC_ROLE);
    }

    public PermissionCompiler(@NonNull String publicRole) {
        this.publicRole = publicRole;
    }

    @NonNull
    public PermissionTable compile(@NonNull Map<String, RoleShorthand> roleRules) {
        return compile(roleRules, null);
    }

    /**
     * Compiles {@code roleRules}.
     *
     * @param roleRules       shorthand per role, in declaration order
     * @param explicitActions the action universe used to expand wildcards; discovered
     *                        from the shorthand when null
     * @return the expanded, immutable table
     * @throws InvalidPermissionRuleException when a key and its shorthand do not fit together
     */
    @NonNull
    public PermissionTable compile(@NonNull Map<String, RoleShorthand> roleRules,
                                   @Nullable Collection<String> explicitActions) {
        Map<String, Map<String, FieldSet>> permissions = new LinkedHashMap<>();
        Map<String, RoleShorthand> roles = new LinkedHashMap<>();

        // Public sugar has to be folded in first so grants can inherit from it
        Map<String, FieldSet> publicSugar = new LinkedHashMap<>();
        roleRules.forEach((key, shorthand) -> {
            if (Crud.isBuiltIn(key)) {
                if (!(shorthand instanceof RoleShorthand.PublicFields publicFields)) {
                    throw new InvalidPermissionRuleException(key,
                            "a built-in action key only takes a plain field list");
                }
                publicSugar.put(key, FieldSet.of(publicFields.fields()));
            } else if (shorthand instanceof RoleShorthand.PublicFields) {
                throw new InvalidPermissionRuleException(key,
                        "a plain field list is only allowed under a built-in action key");
            } else if (shorthand == null) {
                throw new InvalidPermissionRuleException(key, "missing rule");
            } else {
                roles.put(key, shorthand);
            }
        });
        if (!publicSugar.isEmpty()) {
            permissions.put(publicRole, publicSugar);
        }

        Set<String> actions = explicitActions != null
                ? new LinkedHashSet<>(explicitActions)
                : discoverActions(roles.values());

        RoleShorthand explicitPublic = roles.remove(publicRole);
        if (explicitPublic != null) {
            Map<String, FieldSet> merged = new LinkedHashMap<>(permissions.getOrDefault(publicRole, Map.of()));
            merged.putAll(expand(publicRole, explicitPublic, actions, Map.of()));
            permissions.put(publicRole, merged);
        }

        Map<String, FieldSet> inherited = permissions.getOrDefault(publicRole, Map.of());
        roles.forEach((role, shorthand) -> permissions.put(role, expand(role, shorthand, actions, inherited)));

        PermissionTable table = PermissionTable.of(permissions);
        log.debug("Compiled permissions: roles={}, actions={}", table.roles(), actions);
        return table;
    }

    /**
     * CRUD plus every action mentioned by the shorthand.
     */
    @NonNull
    public Set<String> discoverActions(@NonNull Collection<RoleShorthand> shorthands) {
        Set<String> actions = new LinkedHashSet<>(Crud.actions());
        for (RoleShorthand shorthand : shorthands) {
            if (shorthand instanceof RoleShorthand.Rules rules) {
                rules.rules().forEach(rule -> actions.addAll(rule.actions()));
            } else if (shorthand instanceof RoleShorthand.Expanded expanded) {
                actions.addAll(expanded.table().keySet());
            }
        }
        return actions;
    }

    private Map<String, FieldSet> expand(String role, RoleShorthand shorthand, Set<String> actions,
                                         Map<String, FieldSet> inherited) {
        Map<String, FieldSet> expanded = new LinkedHashMap<>();

        if (shorthand instanceof RoleShorthand.Expanded table) {
            expanded.putAll(table.table());
        } else if (shorthand instanceof RoleShorthand.Wildcard) {
            actions.forEach(action -> expanded.put(action, FieldSet.all()));
        } else if (shorthand instanceof RoleShorthand.Rules rules) {
            for (Rule rule : rules.rules()) {
                if (rule instanceof Rule.BareAction bare) {
                    expanded.put(bare.action(), FieldSet.all());
                } else if (rule instanceof Rule.Grant grant) {
                    for (String action : grant.actions()) {
                        FieldSet fields = FieldSet.of(grant.fields())
                                .concat(inherited.getOrDefault(action, FieldSet.none()));
                        expanded.put(action, fields);
                    }
                }
            }
        } else {
            throw new InvalidPermissionRuleException(role, "unsupported shorthand " + shorthand);
        }
        return expanded;
    }
}
