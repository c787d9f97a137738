package com.example.fieldauthz.record;

import com.example.fieldauthz.exception.UnknownFieldException;
import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.model.FieldSet;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * A record whose every field access is authorized.
 *
 * <p>{@link #get}, {@link #set} and {@link #delete} check {@code read}, {@code update} and
 * {@code delete} respectively before touching the stored value, and propagate the denial
 * when the check fails. Overrides ({@link #allow}, {@link #deny}, the scoped variants)
 * only affect this instance.
 */
@Slf4j
public class AuthorizedRecord {

    private final RecordType type;
    private final Map<String, Object> values = new LinkedHashMap<>();
    private final AuthorizationContext authorizationContext;

    AuthorizedRecord(RecordType type, Map<String, ?> initialValues, RecordOptions options) {
        this.type = type;
        // Values are written unchecked; create checks below run in their own scope
        this.authorizationContext = new AuthorizationContext(false);

        if (options.checkCreate()) {
            try (AuthorizationScope ignored = authorizationContext.protection()) {
                initialValues.keySet().forEach(field -> authorize(Crud.CREATE.action(), field));
            }
        }

        initialValues.forEach((field, value) -> {
            requireDeclared(field);
            values.put(field, value);
        });

        authorizationContext.setEnabled(options.protect());
    }

    public RecordType getType() {
        return type;
    }

    public AuthorizationContext getAuthorizationContext() {
        return authorizationContext;
    }

    // -- Field access ------------------------------------------------------------

    @Nullable
    public Object get(String field) {
        authorize(Crud.READ.action(), field);
        requireDeclared(field);
        return values.get(field);
    }

    public void set(String field, @Nullable Object value) {
        authorize(Crud.UPDATE.action(), field);
        requireDeclared(field);
        values.put(field, value);
    }

    public void delete(String field) {
        authorize(Crud.DELETE.action(), field);
        requireDeclared(field);
        values.remove(field);
    }

    /**
     * Checks whether the current actor may perform {@code action} on {@code field}.
     *
     * @throws com.example.fieldauthz.exception.FieldAccessException (or the configured
     *                                                               error type) when denied
     */
    public void authorize(String action, String field) {
        type.getAuthorizer().authorize(this, action, field);
    }

    /**
     * The authorizable fields the current actor may perform {@code action} on.
     * A field whose check fails is left out.
     */
    public List<String> authorizedFields(String action) {
        List<String> fields = new ArrayList<>();
        for (String field : type.authorizableFields()) {
            try {
                authorize(action, field);
            } catch (RuntimeException e) {
                log.debug("Excluding {}.{} from authorized '{}' fields: {}",
                        type.getName(), field, action, e.getMessage());
                continue;
            }
            fields.add(field);
        }
        return fields;
    }

    // -- Protection ----------------------------------------------------------------

    public boolean isProtected() {
        return authorizationContext.isEnabled();
    }

    /**
     * Turns authorization on.
     */
    public AuthorizedRecord protect() {
        authorizationContext.setEnabled(true);
        return this;
    }

    /**
     * Turns authorization off. Prefer {@link #exposure()} or {@link #allowed} to relax
     * checks for a bounded block.
     */
    public AuthorizedRecord expose() {
        authorizationContext.setEnabled(false);
        return this;
    }

    public AuthorizationScope protection() {
        return authorizationContext.protection();
    }

    public AuthorizationScope exposure() {
        return authorizationContext.exposure();
    }

    public <T> T withProtection(Supplier<T> work) {
        try (AuthorizationScope ignored = protection()) {
            return work.get();
        }
    }

    public <T> T withExposure(Supplier<T> work) {
        try (AuthorizationScope ignored = exposure()) {
            return work.get();
        }
    }

    // -- Overrides -----------------------------------------------------------------

    /**
     * Allows {@code action} on every authorizable field.
     *
     * @return the action as a list
     */
    public List<String> allow(String action) {
        return allow(List.of(action), null);
    }

    public List<String> allow(String action, String... fields) {
        return allow(List.of(action), List.of(fields));
    }

    /**
     * Allows {@code actions} on {@code fields}, or on every authorizable field when
     * {@code fields} is null.
     *
     * @return the normalized action list, so the caller can clear exactly those keys
     */
    public List<String> allow(Collection<String> actions, @Nullable Collection<String> fields) {
        return authorizationContext.allow(actions, overrideFields(fields));
    }

    public List<String> deny(String action) {
        return deny(List.of(action), null);
    }

    public List<String> deny(String action, String... fields) {
        return deny(List.of(action), List.of(fields));
    }

    public List<String> deny(Collection<String> actions, @Nullable Collection<String> fields) {
        return authorizationContext.deny(actions, overrideFields(fields));
    }

    public AuthorizationScope allowed(String action) {
        return allowed(List.of(action), null);
    }

    public AuthorizationScope allowed(String action, String... fields) {
        return allowed(List.of(action), List.of(fields));
    }

    /**
     * Allows {@code actions} until the scope closes. On close the touched actions are
     * cleared, not restored to what they were before.
     */
    public AuthorizationScope allowed(Collection<String> actions, @Nullable Collection<String> fields) {
        List<String> touched = allow(actions, fields);
        return () -> authorizationContext.clearAllowed(touched);
    }

    public AuthorizationScope denied(String action) {
        return denied(List.of(action), null);
    }

    public AuthorizationScope denied(String action, String... fields) {
        return denied(List.of(action), List.of(fields));
    }

    public AuthorizationScope denied(Collection<String> actions, @Nullable Collection<String> fields) {
        List<String> touched = deny(actions, fields);
        return () -> authorizationContext.clearDenied(touched);
    }

    public <T> T withAllowed(String action, Supplier<T> work) {
        return withAllowed(List.of(action), null, work);
    }

    public <T> T withAllowed(Collection<String> actions, @Nullable Collection<String> fields, Supplier<T> work) {
        try (AuthorizationScope ignored = allowed(actions, fields)) {
            return work.get();
        }
    }

    public <T> T withDenied(String action, Supplier<T> work) {
        return withDenied(List.of(action), null, work);
    }

    public <T> T withDenied(Collection<String> actions, @Nullable Collection<String> fields, Supplier<T> work) {
        try (AuthorizationScope ignored = denied(actions, fields)) {
            return work.get();
        }
    }

    // -------------------------------------------------------------------------------

    @NonNull
    private FieldSet overrideFields(@Nullable Collection<String> fields) {
        return FieldSet.of(fields != null ? fields : type.authorizableFields());
    }

    private void requireDeclared(String field) {
        if (!type.declares(field)) {
            throw new UnknownFieldException(type.getName(), field);
        }
    }

    @Override
    public String toString() {
        return "AuthorizedRecord[" + type.getName() + "@" + Integer.toHexString(System.identityHashCode(this)) + "]";
    }
}
