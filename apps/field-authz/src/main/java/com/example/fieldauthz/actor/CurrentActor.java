package com.example.fieldauthz.actor;

import org.springframework.lang.Nullable;

import java.util.function.Supplier;

/**
 * Binds the acting user to the current thread for the duration of a unit of work.
 */
public final class CurrentActor {

    private static final ThreadLocal<Object> ACTOR = new ThreadLocal<>();

    private CurrentActor() {
        // Utility class
    }

    @Nullable
    public static Object get() {
        return ACTOR.get();
    }

    /**
     * Runs {@code work} as {@code actor}, restoring the previously bound actor afterwards.
     */
    public static <T> T callAs(@Nullable Object actor, Supplier<T> work) {
        Object previous = ACTOR.get();
        ACTOR.set(actor);
        try {
            return work.get();
        } finally {
            if (previous == null) {
                ACTOR.remove();
            } else {
                ACTOR.set(previous);
            }
        }
    }

    public static void runAs(@Nullable Object actor, Runnable work) {
        callAs(actor, () -> {
            work.run();
            return null;
        });
    }
}
