package com.example.fieldauthz.engine;

/**
 * The two flavours of denial.
 */
public enum AccessErrorKind {
    /**
     * The actor lacks permission for a write (create/update/delete or custom verb)
     * but may see the field.
     */
    FORBIDDEN,

    /**
     * The actor may not read the field; reported as absent so existence is not leaked.
     */
    NOT_FOUND
}
