package com.example.fieldauthz.permission.model;

import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;

/**
 * The fields an action is granted on: either every field, or an explicit ordered list.
 *
 * <p>An empty explicit set grants nothing. Duplicates in an explicit set are harmless
 * because only membership is ever tested.
 */
public interface FieldSet {

    /**
     * Token accepted in lists and configuration for "every field".
     */
    String WILDCARD = "*";

    boolean contains(@Nullable String field);

    boolean isAll();

    /**
     * Concatenates this set with another. {@code All} absorbs anything.
     */
    @NonNull
    FieldSet concat(@NonNull FieldSet other);

    static FieldSet all() {
        return All.INSTANCE;
    }

    static FieldSet none() {
        return Explicit.EMPTY;
    }

    static FieldSet of(String... fields) {
        return of(List.of(fields));
    }

    /**
     * Builds a field set from a list of names. A list containing the wildcard token
     * becomes {@link #all()}.
     */
    static FieldSet of(@Nullable Collection<String> fields) {
        if (fields == null || fields.isEmpty()) {
            return none();
        }
        if (fields.contains(WILDCARD)) {
            return all();
        }
        return new Explicit(List.copyOf(fields));
    }

    /**
     * Every field.
     */
    final class All implements FieldSet {

        private static final All INSTANCE = new All();

        private All() {
        }

        @Override
        public boolean contains(@Nullable String field) {
            return true;
        }

        @Override
        public boolean isAll() {
            return true;
        }

        @Override
        @NonNull
        public FieldSet concat(@NonNull FieldSet other) {
            return this;
        }

        @Override
        public String toString() {
            return "[" + WILDCARD + "]";
        }
    }

    /**
     * An explicit, ordered list of field names.
     */
    record Explicit(List<String> fields) implements FieldSet {

        private static final Explicit EMPTY = new Explicit(List.of());

        public Explicit {
            fields = fields == null ? List.of() : List.copyOf(fields);
        }

        @Override
        public boolean contains(@Nullable String field) {
            return field != null && fields.contains(field);
        }

        @Override
        public boolean isAll() {
            return false;
        }

        public boolean isEmpty() {
            return fields.isEmpty();
        }

        @Override
        @NonNull
        public FieldSet concat(@NonNull FieldSet other) {
            if (!(other instanceof Explicit explicit)) {
                return other.isAll() ? other : this;
            }
            List<String> otherFields = explicit.fields();
            if (otherFields.isEmpty()) {
                return this;
            }
            List<String> joined = new ArrayList<>(fields.size() + otherFields.size());
            joined.addAll(fields);
            joined.addAll(otherFields);
            return new Explicit(joined);
        }

        @Override
        public String toString() {
            return fields.toString();
        }
    }
}
