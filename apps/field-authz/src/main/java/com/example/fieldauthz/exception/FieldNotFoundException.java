package com.example.fieldauthz.exception;

import com.example.fieldauthz.engine.AccessDenial;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The field is not visible to the current actor. Worded like a missing field.
 */
@ResponseStatus(HttpStatus.NOT_FOUND)
public class FieldNotFoundException extends FieldAccessException {

    public FieldNotFoundException(AccessDenial denial) {
        super(String.format("%s has no field '%s'", denial.recordType(), denial.field()), denial);
    }
}
