package com.foldermatch.app.session;

import java.util.Objects;
import java.util.Optional;

/**
 * Resultado de uma operacao da sessao. {@code value} so existe quando a operacao foi concluida.
 */
public record Outcome<T>(Status status, String message, T value) {

    public enum Status {
        COMPLETED,
        CANCELLED,
        TIMED_OUT,
        FAILED
    }

    public Outcome {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
    }

    public static <T> Outcome<T> completed(String message, T value) {
        return new Outcome<>(Status.COMPLETED, message, value);
    }

    public static <T> Outcome<T> cancelled(String message) {
        return new Outcome<>(Status.CANCELLED, message, null);
    }

    public static <T> Outcome<T> timedOut(String message) {
        return new Outcome<>(Status.TIMED_OUT, message, null);
    }

    public static <T> Outcome<T> failed(String message) {
        return new Outcome<>(Status.FAILED, message, null);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }

    public Optional<T> result() {
        return Optional.ofNullable(value);
    }
}
