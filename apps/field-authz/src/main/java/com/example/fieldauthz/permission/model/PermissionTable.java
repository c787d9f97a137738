package com.example.fieldauthz.permission.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Compiled permissions of a record type: {@code role -> action -> fields}.
 *
 * <p>Immutable once built. A role without an entry for an action grants nothing for
 * that action, exactly like an empty field set.
 */
public final class PermissionTable {

    private static final PermissionTable EMPTY = new PermissionTable(Map.of());

    private final Map<String, Map<String, FieldSet>> entries;
    private final Set<String> actions;

    private PermissionTable(Map<String, Map<String, FieldSet>> entries) {
        Map<String, Map<String, FieldSet>> copy = new LinkedHashMap<>();
        Set<String> allActions = new LinkedHashSet<>();
        entries.forEach((role, byAction) -> {
            copy.put(role, Collections.unmodifiableMap(new LinkedHashMap<>(byAction)));
            allActions.addAll(byAction.keySet());
        });
        this.entries = Collections.unmodifiableMap(copy);
        this.actions = Collections.unmodifiableSet(allActions);
    }

    public static PermissionTable of(@NonNull Map<String, ? extends Map<String, FieldSet>> entries) {
        Map<String, Map<String, FieldSet>> normalized = new LinkedHashMap<>();
        entries.forEach((role, byAction) -> normalized.put(role, new LinkedHashMap<>(byAction)));
        return new PermissionTable(normalized);
    }

    public static PermissionTable empty() {
        return EMPTY;
    }

    /**
     * The roles that have an entry in this table, in declaration order.
     */
    public Set<String> roles() {
        return entries.keySet();
    }

    /**
     * Union of the actions any role has an entry for.
     */
    public Set<String> actions() {
        return actions;
    }

    /**
     * The fields {@code role} may perform {@code action} on. Never null.
     */
    @NonNull
    public FieldSet fieldsFor(@Nullable String role, @Nullable String action) {
        Map<String, FieldSet> byAction = entries.get(role);
        if (byAction == null) {
            return FieldSet.none();
        }
        FieldSet fields = byAction.get(action);
        return fields != null ? fields : FieldSet.none();
    }

    /**
     * Whether {@code role} may perform {@code action} on {@code field}.
     */
    public boolean grants(@Nullable String role, @Nullable String action, @Nullable String field) {
        return fieldsFor(role, action).contains(field);
    }

    /**
     * Whether the table has an entry (possibly empty) for the role/action pair.
     */
    public boolean hasEntry(@Nullable String role, @Nullable String action) {
        Map<String, FieldSet> byAction = entries.get(role);
        return byAction != null && byAction.containsKey(action);
    }

    /**
     * The entries of one role, or an empty map.
     */
    public Map<String, FieldSet> entriesFor(@Nullable String role) {
        return entries.getOrDefault(role, Map.of());
    }

    public Map<String, Map<String, FieldSet>> asMap() {
        return entries;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PermissionTable other)) return false;
        return entries.equals(other.entries);
    }

    @Override
    public int hashCode() {
        return entries.hashCode();
    }

    @Override
    public String toString() {
        return "PermissionTable" + entries;
    }
}
