package com.example.fieldauthz.exception;

import lombok.Getter;

/**
 * Access to a field the record type does not declare.
 */
@Getter
public class UnknownFieldException extends RuntimeException {

    private final String recordType;
    private final String field;

    public UnknownFieldException(String recordType, String field) {
        super(String.format("'%s' has no field '%s'", recordType, field));
        this.recordType = recordType;
        this.field = field;
    }
}
