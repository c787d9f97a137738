package com.example.fieldauthz.engine;

import com.example.fieldauthz.record.AuthorizedRecord;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Grants the {@code self} role when the actor is the record being accessed.
 */
public class SelfRoleResolver implements RoleResolver {

    public static final String SELF_ROLE = "self";

    private final String role;

    public SelfRoleResolver() {
        this(SELF_ROLE);
    }

    public SelfRoleResolver(String role) {
        this.role = role;
    }

    @Override
    @NonNull
    public Set<String> resolveRoles(@Nullable Object actor, @NonNull AuthorizedRecord record) {
        return actor == record ? Set.of(role) : Set.of();
    }
}
