package com.example.fieldauthz.record;

import com.example.fieldauthz.permission.model.FieldSet;
import org.springframework.lang.NonNull;

import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-instance authorization state: allow/deny overrides, the protected flag and the
 * suspension depth used while the engine consults policies.
 *
 * <p>Not thread-safe. One record instance belongs to one thread at a time.
 */
public final class AuthorizationContext {

    private final Map<String, FieldSet> allowed = new HashMap<>();
    private final Map<String, FieldSet> denied = new HashMap<>();
    private boolean enabled;
    private int suspensionDepth;

    public AuthorizationContext(boolean enabled) {
        this.enabled = enabled;
    }

    /**
     * Whether field accesses are currently checked: protected and not suspended.
     */
    public boolean isActive() {
        return enabled && suspensionDepth == 0;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public boolean isSuspended() {
        return suspensionDepth > 0;
    }

    @NonNull
    public FieldSet allowedFor(String action) {
        return allowed.getOrDefault(action, FieldSet.none());
    }

    @NonNull
    public FieldSet deniedFor(String action) {
        return denied.getOrDefault(action, FieldSet.none());
    }

    public List<String> allow(Collection<String> actions, FieldSet fields) {
        return put(allowed, actions, fields);
    }

    public List<String> deny(Collection<String> actions, FieldSet fields) {
        return put(denied, actions, fields);
    }

    /**
     * Clears the allow overrides of {@code actions}. Earlier values are not restored.
     */
    public void clearAllowed(Collection<String> actions) {
        put(allowed, actions, FieldSet.none());
    }

    public void clearDenied(Collection<String> actions) {
        put(denied, actions, FieldSet.none());
    }

    /**
     * Turns authorization on until the scope closes, then restores the previous flag.
     */
    public AuthorizationScope protection() {
        return switchEnabled(true);
    }

    /**
     * Turns authorization off until the scope closes, then restores the previous flag.
     */
    public AuthorizationScope exposure() {
        return switchEnabled(false);
    }

    /**
     * Suspends authorization until the scope closes. Nested suspensions stack; closing the
     * same scope again has no effect.
     */
    public AuthorizationScope suspend() {
        suspensionDepth++;
        return new SingleUseScope(() -> {
            if (suspensionDepth > 0) {
                suspensionDepth--;
            }
        });
    }

    private AuthorizationScope switchEnabled(boolean value) {
        boolean previous = enabled;
        enabled = value;
        return new SingleUseScope(() -> enabled = previous);
    }

    private static List<String> put(Map<String, FieldSet> target, Collection<String> actions, FieldSet fields) {
        List<String> normalized = List.copyOf(actions);
        normalized.forEach(action -> target.put(action, fields));
        return normalized;
    }

    /**
     * Runs its undo action on the first close only.
     */
    private static final class SingleUseScope implements AuthorizationScope {

        private final Runnable undo;
        private boolean closed;

        private SingleUseScope(Runnable undo) {
            this.undo = undo;
        }

        @Override
        public void close() {
            if (closed) {
                return;
            }
            closed = true;
            undo.run();
        }
    }

    @Override
    public String toString() {
        return "AuthorizationContext{" +
                "enabled=" + enabled +
                ", suspensionDepth=" + suspensionDepth +
                ", allowed=" + allowed +
                ", denied=" + denied +
                '}';
    }
}
