package com.example.fieldauthz.record;

import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.HashSet;
import java.util.Set;

/**
 * Decides which field names go through authorization at all.
 *
 * <p>Exempted are dunder names ({@code __like_this__}), the bookkeeping names used by
 * this layer and by storage integrations, and any names configured on top. Lookups hit a
 * precomputed set since this runs on every access.
 */
public class FieldClassifier {

    public static final Set<String> RESERVED_FIELDS = Set.of(
            // this layer
            "authorize",
            "requiresAuthorization",
            "authorizationContext",
            "authorizableFields",
            "permissions",
            "roles",
            "actions",
            // storage integrations
            "instanceState",
            "classManager",
            "metadata",
            "registry",
            "query",
            "queryClass"
    );

    private final Set<String> exempted;

    public FieldClassifier() {
        this(Set.of());
    }

    public FieldClassifier(@Nullable Collection<String> extraReserved) {
        Set<String> names = new HashSet<>(RESERVED_FIELDS);
        if (extraReserved != null) {
            names.addAll(extraReserved);
        }
        this.exempted = Set.copyOf(names);
    }

    /**
     * Whether {@code name} is wrapped in double underscores, e.g. {@code __class__}.
     */
    public static boolean isDunder(@Nullable String name) {
        return name != null && name.length() > 5 && name.startsWith("__") && name.endsWith("__");
    }

    /**
     * Whether the name is subject to authorization, ignoring instance state.
     */
    public boolean isAuthorizableName(@Nullable String field) {
        return field != null && !isDunder(field) && !exempted.contains(field);
    }

    /**
     * Whether an access to {@code field} has to be checked right now.
     */
    public boolean requiresAuthorization(@Nullable String field, AuthorizationContext context) {
        return context.isActive() && isAuthorizableName(field);
    }

    public Set<String> getExemptedFields() {
        return exempted;
    }
}
