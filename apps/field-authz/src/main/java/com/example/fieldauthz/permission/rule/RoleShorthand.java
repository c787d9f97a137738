package com.example.fieldauthz.permission.rule;

import com.example.fieldauthz.permission.model.FieldSet;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Compact permission rule for a single role, as written before compilation.
 */
public interface RoleShorthand {

    static RoleShorthand wildcard() {
        return Wildcard.INSTANCE;
    }

    static RoleShorthand rules(Rule... rules) {
        return new Rules(List.of(rules));
    }

    static RoleShorthand rules(List<Rule> rules) {
        return new Rules(rules);
    }

    static RoleShorthand expanded(Map<String, FieldSet> table) {
        return new Expanded(table);
    }

    static RoleShorthand publicFields(String... fields) {
        return new PublicFields(List.of(fields));
    }

    static RoleShorthand publicFields(List<String> fields) {
        return new PublicFields(fields);
    }

    /**
     * Every known action on every field.
     */
    final class Wildcard implements RoleShorthand {

        private static final Wildcard INSTANCE = new Wildcard();

        private Wildcard() {
        }

        @Override
        public String toString() {
            return FieldSet.WILDCARD;
        }
    }

    /**
     * A list of bare actions and grants, expanded by the compiler.
     */
    record Rules(List<Rule> rules) implements RoleShorthand {

        public Rules {
            rules = rules == null ? List.of() : List.copyOf(rules);
        }
    }

    /**
     * An already expanded {@code action -> fields} map; passed through unchanged.
     */
    record Expanded(Map<String, FieldSet> table) implements RoleShorthand {

        public Expanded {
            table = table == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(table));
        }
    }

    /**
     * Plain field list. Only meaningful under a built-in action key, where it stands
     * for the public role's fields for that action.
     */
    record PublicFields(List<String> fields) implements RoleShorthand {

        public PublicFields {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }
}
