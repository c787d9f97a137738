package com.example.fieldauthz.engine;

import com.example.fieldauthz.actor.ActorProvider;
import com.example.fieldauthz.audit.FieldAuditEvent;
import com.example.fieldauthz.audit.FieldAuditService;
import com.example.fieldauthz.common.util.StringSanitizer;
import com.example.fieldauthz.exception.FieldAccessException;
import com.example.fieldauthz.observability.metrics.FieldAuthzMetrics;
import com.example.fieldauthz.permission.compiler.PermissionCompiler;
import com.example.fieldauthz.permission.model.Crud;
import com.example.fieldauthz.permission.model.PermissionTable;
import com.example.fieldauthz.record.AuthorizationContext;
import com.example.fieldauthz.record.AuthorizationScope;
import com.example.fieldauthz.record.AuthorizedRecord;
import com.example.fieldauthz.record.RecordType;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Decides every field access of every {@link AuthorizedRecord}.
 *
 * <p>Precedence, first match wins:
 * <ol>
 *   <li>Field exempt from authorization, or authorization off/suspended on the record: allow.</li>
 *   <li>Field denied by override: {@code read} fails as not-found; other actions re-check
 *       {@code read} first (its not-found propagates) and then fail as forbidden.</li>
 *   <li>Field not allowed by override: with the record (and a record actor) suspended, allow
 *       iff one of the actor's roles, the public role included, grants it in the permission
 *       table, else iff the policy fallback allows it. Otherwise fail, not-found for
 *       {@code read} and forbidden for anything else.</li>
 *   <li>Field allowed by override: allow.</li>
 * </ol>
 *
 * <p>Failures of the role resolver or the policy fallback fail closed.
 */
@Slf4j
public class FieldAuthorizer {

    private static final String READ = Crud.READ.action();
    private static final String ANONYMOUS = "anonymous";

    private final String publicRole;
    private final RoleResolver roleResolver;
    @Nullable
    private final PolicyFallback policyFallback;
    private final AccessErrorFactory errorFactory;
    private final ActorProvider actorProvider;
    @Nullable
    private final FieldAuditService auditService;
    @Nullable
    private final FieldAuthzMetrics metrics;

    @Builder
    public FieldAuthorizer(
            @Nullable String publicRole,
            @Nullable RoleResolver roleResolver,
            @Nullable PolicyFallback policyFallback,
            @Nullable AccessErrorFactory errorFactory,
            @Nullable ActorProvider actorProvider,
            @Nullable FieldAuditService auditService,
            @Nullable FieldAuthzMetrics metrics) {
        this.publicRole = publicRole != null ? publicRole : PermissionCompiler.DEFAULT_PUBLIC_ROLE;
        this.roleResolver = roleResolver != null ? roleResolver : RoleResolver.publicOnly();
        this.policyFallback = policyFallback;
        this.errorFactory = errorFactory != null ? errorFactory : AccessErrorFactory.defaults();
        this.actorProvider = actorProvider != null ? actorProvider : ActorProvider.threadBound();
        this.auditService = auditService;
        this.metrics = metrics;
    }

    /**
     * Checks whether the current actor may perform {@code action} on {@code record.field}.
     *
     * @throws RuntimeException the error built by the {@link AccessErrorFactory} when denied
     */
    public void authorize(@NonNull AuthorizedRecord record, @NonNull String action, @NonNull String field) {
        RecordType type = record.getType();
        AuthorizationContext context = record.getAuthorizationContext();

        if (!type.getClassifier().requiresAuthorization(field, context)) {
            return;
        }

        if (context.deniedFor(action).contains(field)) {
            if (READ.equals(action)) {
                throw deny(record, action, field, AccessErrorKind.NOT_FOUND, DecisionSource.OVERRIDE,
                        "override", "read denied by override", Set.of(), null);
            }
            // Not being able to read the field at all wins over forbidden
            authorize(record, READ, field);
            throw deny(record, action, field, AccessErrorKind.FORBIDDEN, DecisionSource.OVERRIDE,
                    "override", action + " denied by override", Set.of(), null);
        }

        if (type.isAuthorizable(field) && !context.allowedFor(action).contains(field)) {
            try (AuthorizationScope ignored = context.suspend()) {
                checkPermissions(record, action, field);
            }
        }
    }

    private void checkPermissions(AuthorizedRecord record, String action, String field) {
        Object actor = actorProvider.currentActor();

        // The resolver and the fallback may read the actor's own fields
        try (AuthorizationScope ignored = suspendActor(actor)) {
            Set<String> roles = resolveRoles(actor, record, action, field);
            PermissionTable permissions = record.getType().getPermissions();

            for (String role : roles) {
                if (permissions.grants(role, action, field)) {
                    allow(record, action, field, actor, roles, DecisionSource.ROLE, role,
                            "granted to role " + role);
                    return;
                }
            }

            String reason = "no role in " + roles + " grants " + action;
            if (policyFallback != null) {
                PolicyDecision decision = evaluateFallback(actor, record, action, field, roles);
                if (decision.isAllowed()) {
                    allow(record, action, field, actor, roles, DecisionSource.POLICY, decision.policyId(),
                            decision.reason());
                    return;
                }
                if (decision.isNotApplicable()) {
                    throw deny(record, action, field, kindFor(action), DecisionSource.DEFAULT, decision.policyId(),
                            reason, roles, null, actor);
                }
                throw deny(record, action, field, kindFor(action), DecisionSource.POLICY, decision.policyId(),
                        decision.reason(), roles, null, actor);
            }

            throw deny(record, action, field, kindFor(action), DecisionSource.DEFAULT, null, reason, roles,
                    null, actor);
        }
    }

    private Set<String> resolveRoles(@Nullable Object actor, AuthorizedRecord record, String action, String field) {
        Set<String> roles = new LinkedHashSet<>();
        roles.add(publicRole);
        try {
            roles.addAll(roleResolver.resolveRoles(actor, record));
        } catch (FieldAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Role resolution failed for {}.{} ({}), denying: {}",
                    record.getType().getName(), field, action, StringSanitizer.forLog(e.getMessage()));
            throw deny(record, action, field, kindFor(action), DecisionSource.ERROR, "role-resolver",
                    "role resolution failed", roles, e, actor);
        }
        return roles;
    }

    private PolicyDecision evaluateFallback(@Nullable Object actor, AuthorizedRecord record, String action,
                                            String field, Set<String> roles) {
        PolicyDecision decision;
        try {
            decision = policyFallback.evaluate(actor, action, record, field);
        } catch (FieldAccessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.warn("Policy fallback failed for {}.{} ({}), denying: {}",
                    record.getType().getName(), field, action, StringSanitizer.forLog(e.getMessage()));
            throw deny(record, action, field, kindFor(action), DecisionSource.ERROR, "policy-fallback",
                    "policy evaluation failed", roles, e, actor);
        }
        if (decision == null) {
            return PolicyDecision.notApplicable("policy-fallback");
        }
        return decision;
    }

    private AuthorizationScope suspendActor(@Nullable Object actor) {
        if (actor instanceof AuthorizedRecord actorRecord) {
            return actorRecord.getAuthorizationContext().suspend();
        }
        return AuthorizationScope.NOOP;
    }

    private static AccessErrorKind kindFor(String action) {
        return READ.equals(action) ? AccessErrorKind.NOT_FOUND : AccessErrorKind.FORBIDDEN;
    }

    private void allow(AuthorizedRecord record, String action, String field, @Nullable Object actor,
                       Set<String> roles, DecisionSource source, @Nullable String decidedBy, String reason) {
        log.debug("Allowed {} on {}.{} ({}: {})", action, record.getType().getName(), field, source, decidedBy);

        if (metrics != null) {
            metrics.recordDecision(true, source, action);
        }
        if (auditService != null) {
            auditService.logDecision(FieldAuditEvent.of(FieldAuditEvent.Outcome.ALLOW, source, decidedBy, reason,
                    null, describe(actor), roles, record.getType().getName(), field, action));
        }
    }

    private RuntimeException deny(AuthorizedRecord record, String action, String field, AccessErrorKind kind,
                                  DecisionSource source, @Nullable String decidedBy, String reason,
                                  Set<String> roles, @Nullable Throwable cause) {
        return deny(record, action, field, kind, source, decidedBy, reason, roles, cause,
                actorProvider.currentActor());
    }

    private RuntimeException deny(AuthorizedRecord record, String action, String field, AccessErrorKind kind,
                                  DecisionSource source, @Nullable String decidedBy, String reason,
                                  Set<String> roles, @Nullable Throwable cause, @Nullable Object actor) {
        String recordType = record.getType().getName();
        log.debug("Denied {} on {}.{} as {} ({}: {})", action, recordType, field, kind, source, reason);

        if (metrics != null) {
            metrics.recordDecision(false, source, action);
        }
        if (auditService != null) {
            FieldAuditEvent.Outcome outcome = source == DecisionSource.ERROR
                    ? FieldAuditEvent.Outcome.ERROR
                    : FieldAuditEvent.Outcome.DENY;
            auditService.logDecision(FieldAuditEvent.of(outcome, source, decidedBy, reason, kind.name(),
                    describe(actor), roles, recordType, field, action));
        }

        return errorFactory.create(new AccessDenial(kind, recordType, action, field, reason, cause));
    }

    private static String describe(@Nullable Object actor) {
        return actor == null ? ANONYMOUS : StringSanitizer.forLog(actor);
    }
}
