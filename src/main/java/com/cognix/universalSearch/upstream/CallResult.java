package com.cognix.universalSearch.upstream;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a single external call: either a payload or a tagged failure.
 *
 * Callers decide what the degraded value is; a CallResult itself never throws
 * on access except through {@link #value()} on a failure.
 *
 * @param <T> payload type
 */
public final class CallResult<T> {

    private final T value;
    private final FailureKind failureKind;
    private final String failureMessage;
    private final int statusCode;

    private CallResult(T value, FailureKind failureKind, String failureMessage, int statusCode) {
        this.value = value;
        this.failureKind = failureKind;
        this.failureMessage = failureMessage;
        this.statusCode = statusCode;
    }

    public static <T> CallResult<T> success(T value) {
        return new CallResult<>(Objects.requireNonNull(value, "value"), null, null, 0);
    }

    public static <T> CallResult<T> failure(FailureKind kind, String message) {
        return new CallResult<>(null, Objects.requireNonNull(kind, "kind"), message, 0);
    }

    public static <T> CallResult<T> httpFailure(int statusCode, String message) {
        return new CallResult<>(null, FailureKind.HTTP_STATUS, message, statusCode);
    }

    public boolean isSuccess() {
        return failureKind == null;
    }

    public boolean isFailure() {
        return failureKind != null;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    public T value() {
        if (isFailure()) {
            throw new IllegalStateException("No value on failed call: " + failureKind + " " + failureMessage);
        }
        return value;
    }

    public T orElse(T fallback) {
        return isSuccess() ? value : fallback;
    }

    public FailureKind failureKind() {
        return failureKind;
    }

    public String failureMessage() {
        return failureMessage;
    }

    /**
     * HTTP status of an {@link FailureKind#HTTP_STATUS} failure, 0 otherwise.
     */
    public int statusCode() {
        return statusCode;
    }

    /**
     * Whether retrying the call may help: timeouts, transport errors and 5xx answers.
     */
    public boolean isRetryable() {
        if (isSuccess()) {
            return false;
        }
        return failureKind.isTransient() || (failureKind == FailureKind.HTTP_STATUS && statusCode >= 500);
    }

    /**
     * Transforms the payload; a mapping function that throws turns the result into a
     * {@link FailureKind#MALFORMED} failure, and a null mapping into {@link FailureKind#EMPTY}.
     */
    public <R> CallResult<R> map(Function<? super T, ? extends R> mapper) {
        if (isFailure()) {
            return new CallResult<>(null, failureKind, failureMessage, statusCode);
        }
        try {
            R mapped = mapper.apply(value);
            return mapped == null ? failure(FailureKind.EMPTY, "mapping produced no value") : success(mapped);
        } catch (RuntimeException e) {
            return failure(FailureKind.MALFORMED, e.getMessage());
        }
    }

    @Override
    public String toString() {
        return isSuccess()
                ? "CallResult[success]"
                : "CallResult[" + failureKind + (statusCode > 0 ? " " + statusCode : "") + ": " + failureMessage + "]";
    }
}
