package com.hcltech.typedkafka.common.errorsor;

import com.hcltech.typedkafka.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Objects;
import java.util.function.Function;

/**
 * Either a non-null value or a non-empty list of error messages. Used wherever a failure is an expected
 * outcome that the caller inspects, such as decoding bytes that may not match the payload type.
 */
public sealed interface ErrorsOr<T> permits ErrorsOr.Value, ErrorsOr.Errors {

    record Value<T>(T value) implements ErrorsOr<T> {
        public Value {
            Objects.requireNonNull(value, "value");
        }
    }

    record Errors<T>(List<String> errors) implements ErrorsOr<T> {
        public Errors {
            errors = List.copyOf(errors);
            if (errors.isEmpty()) throw new IllegalArgumentException("Errors must not be empty");
        }
    }

    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Errors<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Errors<>(errors);
    }

    /** Runs {@code body}; an exception becomes a single error message built by {@code toMessage}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMessage) {
        try {
            return lift(body.get());
        } catch (Exception e) {
            return error(toMessage.apply(e));
        }
    }

    default boolean isValue() {
        return this instanceof Value;
    }

    default boolean isError() {
        return this instanceof Errors;
    }

    default List<String> getErrors() {
        return this instanceof Errors<T> e ? e.errors() : List.of();
    }

    default T valueOrThrow() {
        if (this instanceof Value<T> v) return v.value();
        throw new IllegalStateException("Expected value but got errors: " + getErrors());
    }

    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        if (this instanceof Value<T> v) return lift(f.apply(v.value()));
        return errors(getErrors());
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        if (this instanceof Value<T> v) return f.apply(v.value());
        return errors(getErrors());
    }
}
