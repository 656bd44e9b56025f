package org.carball.probe.engine;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

/**
 * Result of a call into an engine query surface: either a value or a classified failure.
 * Expected failures such as a blocked interface are values here, not exceptions.
 */
public final class Outcome<T> {

    private final T value;
    private final ErrorKind errorKind;
    private final String message;
    private final Throwable cause;

    private Outcome(T value, ErrorKind errorKind, String message, Throwable cause) {
        this.value = value;
        this.errorKind = errorKind;
        this.message = message;
        this.cause = cause;
    }

    public static <T> Outcome<T> success(T value) {
        return new Outcome<>(Objects.requireNonNull(value, "value"), null, null, null);
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message) {
        return failure(kind, message, null);
    }

    public static <T> Outcome<T> failure(ErrorKind kind, String message, Throwable cause) {
        return new Outcome<>(null, Objects.requireNonNull(kind, "kind"), message, cause);
    }

    public boolean isSuccess() {
        return errorKind == null;
    }

    public boolean is(ErrorKind kind) {
        return errorKind == kind;
    }

    public T value() {
        if (!isSuccess()) {
            throw new IllegalStateException("No value on failed outcome: " + errorKind + " " + message);
        }
        return value;
    }

    public ErrorKind errorKind() {
        return errorKind;
    }

    public String message() {
        return message;
    }

    public Optional<Throwable> cause() {
        return Optional.ofNullable(cause);
    }

    public <R> Outcome<R> map(Function<? super T, ? extends R> mapper) {
        if (!isSuccess()) {
            return new Outcome<>(null, errorKind, message, cause);
        }
        return Outcome.success(mapper.apply(value));
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "Outcome{success=" + value + "}"
                : "Outcome{" + errorKind + ": " + message + "}";
    }
}
