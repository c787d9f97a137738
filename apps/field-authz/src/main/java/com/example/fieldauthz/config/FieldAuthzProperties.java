package com.example.fieldauthz.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.List;
import java.util.Map;

/**
 * Configuration of the field authorization layer and of the record types declared in YAML.
 *
 * <pre>
 * app:
 *   field-authz:
 *     record-types:
 *       user:
 *         fields: [id, username, fullname, ssn]
 *         public-fields:
 *           read: [id, username]
 *         roles:
 *           self:
 *             actions: [read, delete]
 *             grants:
 *               - actions: [create, update]
 *                 fields: [username, fullname]
 *           admin:
 *             all: true
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "app.field-authz")
public record FieldAuthzProperties(
        Boolean enabled,
        @NotBlank String publicRole,
        Boolean protectByDefault,
        boolean checkCreate,
        List<String> reservedFields,
        AuditProperties audit,
        Map<String, @Valid RecordTypeDefinition> recordTypes
) {
    public FieldAuthzProperties {
        if (enabled == null) {
            enabled = true;
        }
        if (publicRole == null) {
            publicRole = "public";
        }
        if (protectByDefault == null) {
            protectByDefault = true;
        }
        if (reservedFields == null) {
            reservedFields = List.of();
        }
        if (audit == null) {
            audit = new AuditProperties(true);
        }
        if (recordTypes == null) {
            recordTypes = Map.of();
        }
    }

    public record AuditProperties(boolean enabled) {}

    /**
     * A record type and its permission shorthand.
     *
     * @param fields       declared fields, in order
     * @param actions      explicit action universe; discovered from the rules when empty
     * @param publicFields public fields per built-in action ({@code read: [id, username]})
     * @param roles        rules per role
     */
    public record RecordTypeDefinition(
            List<String> fields,
            List<String> actions,
            Map<String, List<String>> publicFields,
            Map<String, RoleDefinition> roles
    ) {
        public RecordTypeDefinition {
            if (fields == null) fields = List.of();
            if (actions == null) actions = List.of();
            if (publicFields == null) publicFields = Map.of();
            if (roles == null) roles = Map.of();
        }
    }

    /**
     * Rules of one role. Exactly one style is used: {@code all}, {@code expanded}, or
     * {@code actions} plus {@code grants}.
     *
     * @param all      every action on every field
     * @param actions  actions allowed on every field
     * @param grants   actions allowed on listed fields (plus the public fields)
     * @param expanded an already expanded {@code action -> fields} table
     */
    public record RoleDefinition(
            boolean all,
            List<String> actions,
            List<GrantDefinition> grants,
            Map<String, List<String>> expanded
    ) {
        public RoleDefinition {
            if (actions == null) actions = List.of();
            if (grants == null) grants = List.of();
            if (expanded == null) expanded = Map.of();
        }
    }

    public record GrantDefinition(
            List<String> actions,
            List<String> fields
    ) {
        public GrantDefinition {
            if (actions == null) actions = List.of();
            if (fields == null) fields = List.of();
        }
    }
}
