package com.example.conversations.service;

import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Outcome of a service operation. Expected failures (missing entity, invalid input)
 * are values rather than exceptions; the web layer turns each variant into a response.
 *
 * @param <T> payload type on success
 */
public sealed interface ServiceResult<T> {

    record Ok<T>(T value) implements ServiceResult<T> {
    }

    /**
     * @param entity name of the entity that was looked up, e.g. {@code "Conversation"}
     */
    record NotFound<T>(String entity) implements ServiceResult<T> {
    }

    /**
     * @param errors field name to its validation messages
     */
    record Invalid<T>(Map<String, List<String>> errors) implements ServiceResult<T> {
        public Invalid {
            errors = Map.copyOf(errors);
        }
    }

    static <T> ServiceResult<T> ok(T value) {
        return new Ok<>(value);
    }

    static <T> ServiceResult<T> notFound(String entity) {
        return new NotFound<>(entity);
    }

    static <T> ServiceResult<T> invalid(Map<String, List<String>> errors) {
        return new Invalid<>(errors);
    }

    /**
     * Transforms the payload of an {@link Ok}; failures pass through unchanged.
     */
    default <R> ServiceResult<R> map(Function<? super T, ? extends R> mapper) {
        if (this instanceof Ok<T> ok) {
            return new Ok<>(mapper.apply(ok.value()));
        }
        if (this instanceof NotFound<T> notFound) {
            return new NotFound<>(notFound.entity());
        }
        return new Invalid<>(((Invalid<T>) this).errors());
    }
}
