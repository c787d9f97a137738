package com.example.fieldauthz.permission.rule;

import java.util.List;

/**
 * One element of a role's rule list.
 */
public interface Rule {

    /**
     * The actions this rule names.
     */
    List<String> actions();

    static Rule action(String action) {
        return new BareAction(action);
    }

    static Rule grant(String action, List<String> fields) {
        return new Grant(List.of(action), fields);
    }

    static Rule grant(List<String> actions, List<String> fields) {
        return new Grant(actions, fields);
    }

    /**
     * An action allowed on every field.
     */
    record BareAction(String action) implements Rule {

        public BareAction {
            if (action == null || action.isBlank()) {
                throw new IllegalArgumentException("Action name must not be blank");
            }
        }

        @Override
        public List<String> actions() {
            return List.of(action);
        }
    }

    /**
     * Actions allowed on exactly the listed fields, plus whatever the public role
     * already has for the same action.
     */
    record Grant(List<String> actions, List<String> fields) implements Rule {

        public Grant {
            if (actions == null || actions.isEmpty()) {
                throw new IllegalArgumentException("A grant needs at least one action");
            }
            actions = List.copyOf(actions);
            fields = fields == null ? List.of() : List.copyOf(fields);
        }
    }
}
