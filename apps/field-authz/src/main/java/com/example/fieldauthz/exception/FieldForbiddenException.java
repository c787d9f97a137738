package com.example.fieldauthz.exception;

import com.example.fieldauthz.engine.AccessDenial;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * The current actor is not allowed to perform a write action on a field it can see.
 */
@ResponseStatus(HttpStatus.FORBIDDEN)
public class FieldForbiddenException extends FieldAccessException {

    public FieldForbiddenException(AccessDenial denial) {
        super(String.format("Current actor is not allowed to perform '%s' on %s.%s",
                denial.action(), denial.recordType(), denial.field()), denial);
    }
}
