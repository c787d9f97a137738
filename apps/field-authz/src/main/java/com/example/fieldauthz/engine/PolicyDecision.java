package com.example.fieldauthz.engine;

/**
 * Verdict of a {@link PolicyFallback}.
 */
public record PolicyDecision(
        Decision decision,
        String reason,
        String policyId
) {
    public enum Decision {
        ALLOW,
        DENY,
        NOT_APPLICABLE  // Policy doesn't cover this request
    }

    public static PolicyDecision allow(String policyId, String reason) {
        return new PolicyDecision(Decision.ALLOW, reason, policyId);
    }

    public static PolicyDecision deny(String policyId, String reason) {
        return new PolicyDecision(Decision.DENY, reason, policyId);
    }

    public static PolicyDecision notApplicable(String policyId) {
        return new PolicyDecision(Decision.NOT_APPLICABLE, "Policy not applicable", policyId);
    }

    public boolean isAllowed() {
        return decision == Decision.ALLOW;
    }

    public boolean isNotApplicable() {
        return decision == Decision.NOT_APPLICABLE;
    }
}
