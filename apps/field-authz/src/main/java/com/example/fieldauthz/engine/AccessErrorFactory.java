package com.example.fieldauthz.engine;

import com.example.fieldauthz.exception.FieldAccessException;
import com.example.fieldauthz.exception.FieldForbiddenException;
import com.example.fieldauthz.exception.FieldNotFoundException;
import org.springframework.lang.NonNull;

/**
 * Renders a denial into the exception thrown to the caller.
 *
 * <p>Deployments plug in their own exception types here; the engine only decides the
 * {@link AccessErrorKind}.
 */
@FunctionalInterface
public interface AccessErrorFactory {

    @NonNull
    RuntimeException create(@NonNull AccessDenial denial);

    /**
     * Default rendering: {@link FieldNotFoundException} or {@link FieldForbiddenException}.
     */
    static AccessErrorFactory defaults() {
        return denial -> {
            FieldAccessException error = switch (denial.kind()) {
                case NOT_FOUND -> new FieldNotFoundException(denial);
                case FORBIDDEN -> new FieldForbiddenException(denial);
            };
            if (denial.cause() != null) {
                error.initCause(denial.cause());
            }
            return error;
        };
    }
}
