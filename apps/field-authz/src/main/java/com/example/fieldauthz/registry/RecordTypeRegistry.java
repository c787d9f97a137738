package com.example.fieldauthz.registry;

import com.example.fieldauthz.engine.FieldAuthorizer;
import com.example.fieldauthz.permission.compiler.PermissionCompiler;
import com.example.fieldauthz.permission.model.PermissionTable;
import com.example.fieldauthz.permission.rule.RoleShorthand;
import com.example.fieldauthz.record.FieldClassifier;
import com.example.fieldauthz.record.RecordOptions;
import com.example.fieldauthz.record.RecordType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Record types by name. Permissions are compiled once, when the type is registered.
 */
@Slf4j
public class RecordTypeRegistry {

    private final Map<String, RecordType> types = new ConcurrentHashMap<>();

    private final PermissionCompiler compiler;
    private final FieldAuthorizer authorizer;
    private final FieldClassifier classifier;
    private final RecordOptions defaultOptions;

    public RecordTypeRegistry(PermissionCompiler compiler, FieldAuthorizer authorizer,
                              FieldClassifier classifier, RecordOptions defaultOptions) {
        this.compiler = compiler;
        this.authorizer = authorizer;
        this.classifier = classifier;
        this.defaultOptions = defaultOptions;
    }

    /**
     * Compiles {@code rules} and registers the resulting type.
     *
     * @param explicitActions action universe; discovered from the rules when null or empty
     * @throws IllegalStateException when a type with that name already exists
     */
    public RecordType register(@NonNull String name, @NonNull List<String> fields,
                               @NonNull Map<String, RoleShorthand> rules,
                               @Nullable Collection<String> explicitActions) {
        PermissionTable permissions = compiler.compile(rules,
                explicitActions == null || explicitActions.isEmpty() ? null : explicitActions);
        return register(name, fields, permissions);
    }

    /**
     * Registers a type with an already compiled table.
     */
    public RecordType register(@NonNull String name, @NonNull List<String> fields,
                               @NonNull PermissionTable permissions) {
        RecordType type = RecordType.builder(name)
                .fields(fields)
                .permissions(permissions)
                .classifier(classifier)
                .authorizer(authorizer)
                .defaultOptions(defaultOptions)
                .build();

        if (types.putIfAbsent(name, type) != null) {
            throw new IllegalStateException("Record type already registered: " + name);
        }
        log.info("Registered record type '{}' with {} fields, roles={}, actions={}",
                name, fields.size(), type.roles(), type.actions());
        return type;
    }

    public Optional<RecordType> find(String name) {
        return Optional.ofNullable(types.get(name));
    }

    /**
     * @throws IllegalArgumentException when no such type is registered
     */
    public RecordType get(String name) {
        return find(name).orElseThrow(() -> new IllegalArgumentException("Unknown record type: " + name));
    }

    public Collection<RecordType> types() {
        return Collections.unmodifiableCollection(types.values());
    }
}
