package com.example.fieldauthz.util;

import com.example.fieldauthz.engine.CompositeRoleResolver;
import com.example.fieldauthz.engine.FieldAuthorizer;
import com.example.fieldauthz.engine.RoleResolver;
import com.example.fieldauthz.engine.SelfRoleResolver;
import com.example.fieldauthz.permission.compiler.PermissionCompiler;
import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.rule.PermissionRules;
import com.example.fieldauthz.record.AuthorizedRecord;
import com.example.fieldauthz.record.RecordType;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Test builder for a "user" record type and its instances.
 *
 * <p>Permissions: public reads {@code id} and {@code username}; {@code self} reads and
 * deletes everything and updates {@code username} and {@code fullname}; {@code admin}
 * does everything.
 */
public class UserRecordTestBuilder {

    public static final List<String> USER_FIELDS = List.of("id", "username", "fullname", "ssn", "managerId");

    private FieldAuthorizer authorizer = FieldAuthorizer.builder()
            .roleResolver(defaultRoleResolver())
            .build();
    private final Map<String, Object> values = new LinkedHashMap<>();

    public static UserRecordTestBuilder aUser() {
        return new UserRecordTestBuilder()
                .withValue("id", "u-1")
                .withValue("username", "alice")
                .withValue("fullname", "Alice Example")
                .withValue("ssn", "123-45-6789");
    }

    /**
     * Actor that is not a record, holding fixed roles.
     */
    public record TestActor(String name, Set<String> roles) {

        public static TestActor admin() {
            return new TestActor("root", Set.of("admin"));
        }

        public static TestActor withRoles(String name, String... roles) {
            return new TestActor(name, Set.of(roles));
        }
    }

    /**
     * {@code self} when the actor is the record, plus the roles of a {@link TestActor}.
     */
    public static RoleResolver defaultRoleResolver() {
        return CompositeRoleResolver.of(
                new SelfRoleResolver(),
                (actor, record) -> actor instanceof TestActor testActor ? testActor.roles() : Set.of());
    }

    public static PermissionRules userRules() {
        return PermissionRules.builder()
                .publicFields(Crud.READ, "id", "username")
                .role("self", r -> r
                        .action("read")
                        .action("delete")
                        .grant(List.of("create", "update"), "username", "fullname"))
                .wildcard("admin");
    }

    public static RecordType userType(FieldAuthorizer authorizer) {
        return RecordType.builder("user")
                .fields(USER_FIELDS)
                .permissions(new PermissionCompiler().compile(userRules().build()))
                .authorizer(authorizer)
                .build();
    }

    public UserRecordTestBuilder withAuthorizer(FieldAuthorizer authorizer) {
        this.authorizer = authorizer;
        return this;
    }

    public UserRecordTestBuilder withValue(String field, Object value) {
        this.values.put(field, value);
        return this;
    }

    public AuthorizedRecord build() {
        return userType(authorizer).newRecord(values);
    }
}
