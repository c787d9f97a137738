package com.example.fieldauthz.engine;

import org.springframework.lang.Nullable;

/**
 * Everything an {@link AccessErrorFactory} needs to render a denial.
 *
 * @param kind       forbidden or not-found, decided by the engine
 * @param recordType name of the record type
 * @param action     the denied action
 * @param field      the denied field
 * @param reason     why the access was denied
 * @param cause      collaborator failure that led to a fail-closed denial, if any
 */
public record AccessDenial(
        AccessErrorKind kind,
        String recordType,
        String action,
        String field,
        String reason,
        @Nullable Throwable cause
) {
    public static AccessDenial of(AccessErrorKind kind, String recordType, String action, String field,
                                  String reason) {
        return new AccessDenial(kind, recordType, action, field, reason, null);
    }
}
