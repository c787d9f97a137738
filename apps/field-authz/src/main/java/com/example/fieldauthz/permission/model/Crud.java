package com.example.fieldauthz.permission.model;

import org.springframework.lang.Nullable;

import java.util.Arrays;
import java.util.List;

/**
 * Built-in CRUD actions.
 *
 * <p>Actions are plain strings everywhere else so that custom verbs can sit next
 * to these four; this enum only names the built-ins.
 */
public enum Crud {
    CREATE("create"),
    READ("read"),
    UPDATE("update"),
    DELETE("delete");

    private static final List<String> ACTIONS = Arrays.stream(values())
            .map(Crud::action)
            .toList();

    private final String action;

    Crud(String action) {
        this.action = action;
    }

    public String action() {
        return action;
    }

    /**
     * The four built-in action names, in declaration order.
     */
    public static List<String> actions() {
        return ACTIONS;
    }

    public static boolean isBuiltIn(@Nullable String action) {
        return action != null && ACTIONS.contains(action);
    }

    @Override
    public String toString() {
        return action;
    }
}
