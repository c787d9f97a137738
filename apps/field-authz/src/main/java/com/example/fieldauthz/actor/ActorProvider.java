package com.example.fieldauthz.actor;

import org.springframework.lang.Nullable;

/**
 * Supplies the actor on whose behalf fields are accessed. {@code null} means anonymous.
 */
@FunctionalInterface
public interface ActorProvider {

    @Nullable
    Object currentActor();

    /**
     * Provider reading the actor bound by {@link CurrentActor}.
     */
    static ActorProvider threadBound() {
        return CurrentActor::get;
    }
}
