package com.starscape.todoapp.common.domain;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a domain operation that can fail in an expected way.
 * Exactly one of value or reason is set: value for {@link Kind#OK}, reason otherwise.
 *
 * @param <T> the success value type
 */
public final class Outcome<T> {

    public enum Kind {
        OK,
        INVALID,
        CONFLICT,
        NOT_FOUND
    }

    private final Kind kind;
    private final T value;
    private final String reason;

    private Outcome(Kind kind, T value, String reason) {
        this.kind = kind;
        this.value = value;
        this.reason = reason;
    }

    public static <T> Outcome<T> ok(T value) {
        return new Outcome<>(Kind.OK, Objects.requireNonNull(value), null);
    }

    public static <T> Outcome<T> invalid(String reason) {
        return new Outcome<>(Kind.INVALID, null, Objects.requireNonNull(reason));
    }

    public static <T> Outcome<T> conflict(String reason) {
        return new Outcome<>(Kind.CONFLICT, null, Objects.requireNonNull(reason));
    }

    public static <T> Outcome<T> notFound(String reason) {
        return new Outcome<>(Kind.NOT_FOUND, null, Objects.requireNonNull(reason));
    }

    public static <T> Outcome<T> fromOptional(Optional<T> value, String notFoundReason) {
        return value.map(Outcome::ok).orElseGet(() -> notFound(notFoundReason));
    }

    public Kind kind() {
        return kind;
    }

    public boolean isOk() {
        return kind == Kind.OK;
    }

    /**
     * @throws IllegalStateException if this outcome is not OK
     */
    public T value() {
        if (kind != Kind.OK) {
            throw new IllegalStateException("No value for outcome " + kind + ": " + reason);
        }
        return value;
    }

    public String reason() {
        return reason;
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (kind == Kind.OK) {
            return Outcome.ok(mapper.apply(value));
        }
        return new Outcome<>(kind, null, reason);
    }

    @Override
    public String toString() {
        return kind == Kind.OK ? "Outcome[OK]" : "Outcome[" + kind + ": " + reason + "]";
    }
}
