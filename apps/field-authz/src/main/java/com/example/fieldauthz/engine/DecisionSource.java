package com.example.fieldauthz.engine;

/**
 * What decided an authorization check.
 */
public enum DecisionSource {
    /** A deny override on the record instance. */
    OVERRIDE,
    /** A role entry of the permission table. */
    ROLE,
    /** The policy fallback. */
    POLICY,
    /** Nothing granted the access. */
    DEFAULT,
    /** A collaborator failed and the check failed closed. */
    ERROR
}
