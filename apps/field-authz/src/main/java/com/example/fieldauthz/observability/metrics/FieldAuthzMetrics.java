package com.example.fieldauthz.observability.metrics;

import com.example.fieldauthz.common.util.StringSanitizer;
import com.example.fieldauthz.engine.DecisionSource;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * Counters for field authorization decisions.
 * Tag values are sanitized and bounded to keep cardinality in check.
 */
public class FieldAuthzMetrics {

    public static final String DECISION = "field_authz.decision";
    public static final String DECISION_DETAILED = "field_authz.decision.detailed";

    private final MeterRegistry registry;

    private final Counter decisionAllowed;
    private final Counter decisionDenied;

    public FieldAuthzMetrics(@NonNull MeterRegistry registry) {
        this.registry = registry;

        this.decisionAllowed = Counter.builder(DECISION)
                .tag("result", "allowed")
                .description("Field accesses allowed after a permission check")
                .register(registry);

        this.decisionDenied = Counter.builder(DECISION)
                .tag("result", "denied")
                .description("Field accesses denied")
                .register(registry);
    }

    public void recordDecision(boolean allowed, @NonNull DecisionSource source, @Nullable String action) {
        if (allowed) {
            decisionAllowed.increment();
        } else {
            decisionDenied.increment();
        }

        registry.counter(DECISION_DETAILED,
                Tags.of("result", allowed ? "allowed" : "denied",
                        "source", StringSanitizer.forTag(source.name()),
                        "action", StringSanitizer.forTag(action)))
                .increment();
    }
}
