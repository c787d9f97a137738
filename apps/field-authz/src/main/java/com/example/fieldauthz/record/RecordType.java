package com.example.fieldauthz.record;

import com.example.fieldauthz.engine.FieldAuthorizer;
import com.example.fieldauthz.permission.model.FieldSet;
import com.example.fieldauthz.permission.model.PermissionTable;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Descriptor of a kind of record: its declared fields and its compiled permissions.
 *
 * <p>The permission table is fixed for the lifetime of the type. Instances are created
 * through {@link #newRecord(Map)} and share the type's authorizer.
 */
public final class RecordType {

    private final String name;
    private final List<String> fields;
    private final Set<String> declared;
    private final PermissionTable permissions;
    private final FieldClassifier classifier;
    private final FieldAuthorizer authorizer;
    private final RecordOptions defaultOptions;
    private final List<String> authorizableFields;
    private final List<String> alwaysAllowedFields;

    private RecordType(Builder builder) {
        this.name = Objects.requireNonNull(builder.name, "name");
        this.fields = List.copyOf(builder.fields);
        this.declared = Set.copyOf(new LinkedHashSet<>(builder.fields));
        this.permissions = Objects.requireNonNull(builder.permissions, "permissions");
        this.classifier = builder.classifier != null ? builder.classifier : new FieldClassifier();
        this.authorizer = Objects.requireNonNull(builder.authorizer, "authorizer");
        this.defaultOptions = builder.defaultOptions != null ? builder.defaultOptions : RecordOptions.defaults();
        this.authorizableFields = fields.stream().filter(classifier::isAuthorizableName).toList();
        this.alwaysAllowedFields = fields.stream().filter(f -> !classifier.isAuthorizableName(f)).toList();
    }

    public static Builder builder(String name) {
        return new Builder(name);
    }

    public AuthorizedRecord newRecord(@NonNull Map<String, ?> values) {
        return newRecord(values, defaultOptions);
    }

    public AuthorizedRecord newRecord(@NonNull Map<String, ?> values, @NonNull RecordOptions options) {
        return new AuthorizedRecord(this, values, options);
    }

    public String getName() {
        return name;
    }

    /**
     * Declared fields, in declaration order.
     */
    public List<String> getFields() {
        return fields;
    }

    public boolean declares(@Nullable String field) {
        return field != null && declared.contains(field);
    }

    /**
     * Declared fields that go through authorization.
     */
    public List<String> authorizableFields() {
        return authorizableFields;
    }

    /**
     * Declared fields that never need authorization. Opposite of {@link #authorizableFields()}.
     */
    public List<String> alwaysAllowedFields() {
        return alwaysAllowedFields;
    }

    public boolean isAuthorizable(@Nullable String field) {
        return declares(field) && classifier.isAuthorizableName(field);
    }

    public PermissionTable getPermissions() {
        return permissions;
    }

    public Set<String> roles() {
        return permissions.roles();
    }

    public Set<String> actions() {
        return permissions.actions();
    }

    /**
     * The fields an actor holding {@code role} may perform {@code action} on.
     */
    public FieldSet authorizedFieldsFor(String role, String action) {
        return permissions.fieldsFor(role, action);
    }

    public FieldClassifier getClassifier() {
        return classifier;
    }

    public FieldAuthorizer getAuthorizer() {
        return authorizer;
    }

    public RecordOptions getDefaultOptions() {
        return defaultOptions;
    }

    @Override
    public String toString() {
        return "RecordType{name='" + name + "', fields=" + fields + ", roles=" + roles() + '}';
    }

    public static final class Builder {

        private final String name;
        private List<String> fields = List.of();
        private PermissionTable permissions = PermissionTable.empty();
        private FieldClassifier classifier;
        private FieldAuthorizer authorizer;
        private RecordOptions defaultOptions;

        private Builder(String name) {
            this.name = name;
        }

        public Builder fields(String... fields) {
            return fields(List.of(fields));
        }

        public Builder fields(List<String> fields) {
            this.fields = fields;
            return this;
        }

        public Builder permissions(PermissionTable permissions) {
            this.permissions = permissions;
            return this;
        }

        public Builder classifier(FieldClassifier classifier) {
            this.classifier = classifier;
            return this;
        }

        public Builder authorizer(FieldAuthorizer authorizer) {
            this.authorizer = authorizer;
            return this;
        }

        public Builder defaultOptions(RecordOptions defaultOptions) {
            this.defaultOptions = defaultOptions;
            return this;
        }

        public RecordType build() {
            return new RecordType(this);
        }
    }
}
