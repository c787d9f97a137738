package com.example.fieldauthz.exception;

import com.example.fieldauthz.engine.AccessDenial;
import com.example.fieldauthz.engine.AccessErrorKind;
import lombok.Getter;

/**
 * Base class of field authorization failures.
 */
@Getter
public abstract class FieldAccessException extends RuntimeException {

    private final AccessErrorKind kind;
    private final String recordType;
    private final String action;
    private final String field;
    private final String reason;

    protected FieldAccessException(String message, AccessDenial denial) {
        super(message);
        this.kind = denial.kind();
        this.recordType = denial.recordType();
        this.action = denial.action();
        this.field = denial.field();
        this.reason = denial.reason();
    }
}
