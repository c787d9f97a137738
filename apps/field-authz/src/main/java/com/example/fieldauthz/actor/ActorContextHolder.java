package com.example.fieldauthz.actor;

import reactor.core.publisher.Mono;
import reactor.util.context.Context;

import java.util.Optional;
import java.util.function.Function;

/**
 * Carries the actor through a Reactor pipeline.
 */
public final class ActorContextHolder {

    private static final String ACTOR_KEY = ActorContextHolder.class.getName() + ".ACTOR";

    private ActorContextHolder() {
        // Utility class
    }

    /**
     * The actor in the subscriber context, or an empty Optional for anonymous access.
     */
    public static Mono<Optional<Object>> getActor() {
        return Mono.deferContextual(ctx -> {
            Optional<Object> actor = ctx.getOrEmpty(ACTOR_KEY);
            return Mono.just(actor);
        });
    }

    public static Function<Context, Context> withActor(Object actor) {
        return context -> context.put(ACTOR_KEY, actor);
    }

    public static Mono<Boolean> hasActor() {
        return Mono.deferContextual(ctx -> Mono.just(ctx.hasKey(ACTOR_KEY)));
    }
}
