package com.crabtrading.backend.dto;

import com.crabtrading.backend.exception.LedgerErrorCode;
import com.crabtrading.backend.exception.LedgerRejectedException;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a ledger operation: either a value or a typed rejection. Rejections never
 * leave partially applied state behind.
 */
public final class LedgerResult<T> {

    private final T value;
    private final LedgerErrorCode error;
    private final String message;

    private LedgerResult(T value, LedgerErrorCode error, String message) {
        this.value = value;
        this.error = error;
        this.message = message;
    }

    public static <T> LedgerResult<T> ok(T value) {
        return new LedgerResult<>(value, null, null);
    }

    public static <T> LedgerResult<T> reject(LedgerErrorCode error) {
        return new LedgerResult<>(null, Objects.requireNonNull(error), null);
    }

    public static <T> LedgerResult<T> reject(LedgerErrorCode error, String message) {
        return new LedgerResult<>(null, Objects.requireNonNull(error), message);
    }

    public boolean isOk() {
        return error == null;
    }

    public boolean isRejected() {
        return error != null;
    }

    public T value() {
        if (error != null) {
            throw new IllegalStateException("No value on rejected result: " + error.code());
        }
        return value;
    }

    public LedgerErrorCode error() {
        return error;
    }

    public String message() {
        return message;
    }

    public <R> LedgerResult<R> map(Function<? super T, ? extends R> mapper) {
        if (error != null) {
            return new LedgerResult<>(null, error, message);
        }
        return LedgerResult.ok(mapper.apply(value));
    }

    /**
     * Re-types a rejection so it can be returned from an operation with a different value type.
     */
    public <R> LedgerResult<R> asRejection() {
        if (error == null) {
            throw new IllegalStateException("Result is not a rejection");
        }
        return new LedgerResult<>(null, error, message);
    }

    public T orElseThrow() {
        if (error != null) {
            throw message == null ? new LedgerRejectedException(error) : new LedgerRejectedException(error, message);
        }
        return value;
    }

    @Override
    public String toString() {
        return error == null ? "LedgerResult[ok=" + value + "]" : "LedgerResult[error=" + error.code() + "]";
    }
}
