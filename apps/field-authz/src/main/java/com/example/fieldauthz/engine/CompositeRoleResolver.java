package com.example.fieldauthz.engine;

import com.example.fieldauthz.record.AuthorizedRecord;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Union of the roles returned by several resolvers, in resolver order.
 */
public class CompositeRoleResolver implements RoleResolver {

    private final List<RoleResolver> delegates;

    public CompositeRoleResolver(List<RoleResolver> delegates) {
        this.delegates = List.copyOf(delegates);
    }

    public static CompositeRoleResolver of(RoleResolver... delegates) {
        return new CompositeRoleResolver(List.of(delegates));
    }

    @Override
    @NonNull
    public Set<String> resolveRoles(@Nullable Object actor, @NonNull AuthorizedRecord record) {
        Set<String> roles = new LinkedHashSet<>();
        for (RoleResolver delegate : delegates) {
            roles.addAll(delegate.resolveRoles(actor, record));
        }
        return roles;
    }
}
