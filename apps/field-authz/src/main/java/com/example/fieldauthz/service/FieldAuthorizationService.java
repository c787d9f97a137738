package com.example.fieldauthz.service;

import com.example.fieldauthz.actor.ActorContextHolder;
import com.example.fieldauthz.actor.CurrentActor;
import com.example.fieldauthz.record.AuthorizedRecord;
import com.example.fieldauthz.record.RecordOptions;
import com.example.fieldauthz.record.RecordType;
import com.example.fieldauthz.registry.RecordTypeRegistry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import reactor.core.publisher.Mono;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Supplier;

/**
 * Reactive entry point: runs field checks as the actor found in the Reactor context.
 *
 * <p>The checks themselves are synchronous; the actor is bound to the calling thread for
 * their duration. Denials are emitted as error signals.
 */
@Slf4j
@RequiredArgsConstructor
public class FieldAuthorizationService {

    private final RecordTypeRegistry registry;

    /**
     * Creates a record of {@code type}, checking {@code create} on every supplied field.
     */
    public Mono<AuthorizedRecord> create(String type, Map<String, ?> values) {
        return asCurrentActor(() -> {
            RecordType recordType = registry.get(type);
            return recordType.newRecord(values, recordType.getDefaultOptions().withCheckCreate(true));
        });
    }

    public Mono<AuthorizedRecord> create(String type, Map<String, ?> values, RecordOptions options) {
        return asCurrentActor(() -> registry.get(type).newRecord(values, options));
    }

    public Mono<Void> authorize(AuthorizedRecord record, String action, String field) {
        return asCurrentActor(() -> {
            record.authorize(action, field);
            return Boolean.TRUE;
        }).then();
    }

    /**
     * Reads a field. Completes empty when the field holds no value.
     */
    public Mono<Object> read(AuthorizedRecord record, String field) {
        return asCurrentActor(() -> record.get(field));
    }

    public Mono<Void> update(AuthorizedRecord record, String field, Object value) {
        return asCurrentActor(() -> {
            record.set(field, value);
            return Boolean.TRUE;
        }).then();
    }

    public Mono<List<String>> authorizedFields(AuthorizedRecord record, String action) {
        return asCurrentActor(() -> record.authorizedFields(action));
    }

    private <T> Mono<T> asCurrentActor(Supplier<T> work) {
        return ActorContextHolder.getActor()
                .flatMap((Optional<Object> actor) -> Mono.fromCallable(
                        () -> CurrentActor.callAs(actor.orElse(null), work)))
                .doOnError(e -> log.debug("Field authorization failed: {}", e.getMessage()));
    }
}
