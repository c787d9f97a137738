package com.example.fieldauthz.engine;

import com.example.fieldauthz.record.AuthorizedRecord;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Set;

/**
 * Resolves the roles an actor holds with respect to a record.
 *
 * <p>The public role does not have to be returned; the engine always adds it. Called
 * with authorization of the record suspended.
 */
@FunctionalInterface
public interface RoleResolver {

    @NonNull
    Set<String> resolveRoles(@Nullable Object actor, @NonNull AuthorizedRecord record);

    /**
     * Resolver granting nothing beyond the public role.
     */
    static RoleResolver publicOnly() {
        return (actor, record) -> Set.of();
    }
}
