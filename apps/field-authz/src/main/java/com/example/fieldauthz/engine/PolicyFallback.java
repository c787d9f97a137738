package com.example.fieldauthz.engine;

import com.example.fieldauthz.record.AuthorizedRecord;
import org.springframework.lang.NonNull;
import org.springframework.lang.Nullable;

/**
 * External rule engine consulted when no role of the actor grants the access.
 *
 * <p>Runs while authorization of the target record (and of the actor, when it is a record)
 * is suspended, so implementations may read fields of either freely. Exceptions other than
 * {@link com.example.fieldauthz.exception.FieldAccessException} are turned into a denial.
 */
@FunctionalInterface
public interface PolicyFallback {

    @NonNull
    PolicyDecision evaluate(@Nullable Object actor, @NonNull String action,
                            @NonNull AuthorizedRecord record, @NonNull String field);
}
