package com.example.fieldauthz.config;

import com.example.fieldauthz.actor.ActorProvider;
import com.example.fieldauthz.audit.FieldAuditService;
import com.example.fieldauthz.engine.AccessErrorFactory;
import com.example.fieldauthz.engine.FieldAuthorizer;
import com.example.fieldauthz.engine.PolicyFallback;
import com.example.fieldauthz.engine.RoleResolver;
import com.example.fieldauthz.observability.metrics.FieldAuthzMetrics;
import com.example.fieldauthz.permission.compiler.PermissionCompiler;
import com.example.fieldauthz.permission.config.PermissionRulesMapper;
import com.example.fieldauthz.record.FieldClassifier;
import com.example.fieldauthz.record.RecordOptions;
import com.example.fieldauthz.registry.RecordTypeRegistry;
import com.example.fieldauthz.service.FieldAuthorizationService;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.micrometer.core.instrument.MeterRegistry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;

/**
 * Wires the field authorization layer and registers the record types declared under
 * {@code app.field-authz.record-types}.
 */
@Slf4j
@AutoConfiguration
@EnableConfigurationProperties(FieldAuthzProperties.class)
@ConditionalOnProperty(prefix = "app.field-authz", name = "enabled", havingValue = "true", matchIfMissing = true)
public class FieldAuthzAutoConfiguration {

    @Bean
    @ConditionalOnMissingBean
    public FieldClassifier fieldClassifier(FieldAuthzProperties properties) {
        return new FieldClassifier(properties.reservedFields());
    }

    @Bean
    @ConditionalOnMissingBean
    public PermissionCompiler permissionCompiler(FieldAuthzProperties properties) {
        return new PermissionCompiler(properties.publicRole());
    }

    @Bean
    @ConditionalOnMissingBean
    public RoleResolver roleResolver() {
        return RoleResolver.publicOnly();
    }

    @Bean
    @ConditionalOnMissingBean
    public AccessErrorFactory accessErrorFactory() {
        return AccessErrorFactory.defaults();
    }

    @Bean
    @ConditionalOnMissingBean
    public ActorProvider actorProvider() {
        return ActorProvider.threadBound();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "app.field-authz.audit", name = "enabled", havingValue = "true", matchIfMissing = true)
    public FieldAuditService fieldAuditService(ObjectProvider<ObjectMapper> objectMapper) {
        return new FieldAuditService(objectMapper.getIfAvailable(ObjectMapper::new));
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldAuthorizer fieldAuthorizer(
            FieldAuthzProperties properties,
            RoleResolver roleResolver,
            AccessErrorFactory errorFactory,
            ActorProvider actorProvider,
            ObjectProvider<PolicyFallback> policyFallback,
            ObjectProvider<FieldAuditService> auditService,
            ObjectProvider<MeterRegistry> meterRegistry) {
        MeterRegistry registry = meterRegistry.getIfAvailable();
        return FieldAuthorizer.builder()
                .publicRole(properties.publicRole())
                .roleResolver(roleResolver)
                .policyFallback(policyFallback.getIfAvailable())
                .errorFactory(errorFactory)
                .actorProvider(actorProvider)
                .auditService(auditService.getIfAvailable())
                .metrics(registry != null ? new FieldAuthzMetrics(registry) : null)
                .build();
    }

    @Bean
    @ConditionalOnMissingBean
    public RecordTypeRegistry recordTypeRegistry(
            FieldAuthzProperties properties,
            PermissionCompiler compiler,
            FieldAuthorizer authorizer,
            FieldClassifier classifier) {
        RecordOptions defaults = new RecordOptions(properties.protectByDefault(), properties.checkCreate());
        RecordTypeRegistry registry = new RecordTypeRegistry(compiler, authorizer, classifier, defaults);

        properties.recordTypes().forEach((name, definition) -> registry.register(
                name,
                definition.fields(),
                PermissionRulesMapper.toShorthand(definition),
                definition.actions()));

        log.info("Field authorization ready: {} record types, public role '{}'",
                registry.types().size(), properties.publicRole());
        return registry;
    }

    @Bean
    @ConditionalOnMissingBean
    public FieldAuthorizationService fieldAuthorizationService(RecordTypeRegistry registry) {
        return new FieldAuthorizationService(registry);
    }
}
