package com.intent.vision.core.common;

import com.intent.vision.core.common.exception.BaseForecastException;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

@Getter
@ToString
public final class Result<T> {

    private final boolean success;
    private final T data;
    private final String error;
    private final String errorCode;
    private final Instant timestamp;

    private Result(boolean success, T data, String error, String errorCode, Instant timestamp) {
        this.success = success;
        this.data = data;
        this.error = error;
        this.errorCode = errorCode;
        this.timestamp = (timestamp == null ? Instant.now() : timestamp);
    }

    // ---------- factories ----------
    public static <T> Result<T> ok(T data) {
        return new Result<>(true, data, null, null, Instant.now());
    }

    public static <T> Result<T> fail(String code, String message) {
        return new Result<>(false, null, message, code, Instant.now());
    }

    /**
     * Failure carrying the error code of an application exception.
     */
    public static <T> Result<T> fail(BaseForecastException ex) {
        return new Result<>(false, null, ex.getMessage(), ex.getErrorCode(), Instant.now());
    }

    // ---------- convenience helpers ----------

    public boolean isOk() {
        return success;
    }

    public T get() {
        return data;
    }

    public boolean isFailure() {
        return !success;
    }

    public void ifSuccess(Consumer<? super T> consumer) {
        if (success) consumer.accept(data);
    }

    /**
     * Maps the payload when OK; propagates failure otherwise.
     */
    public <R> Result<R> map(Function<? super T, ? extends R> mapper) {
        Objects.requireNonNull(mapper, "mapper");
        if (isFailure()) return Result.fail(errorCode, error);
        return Result.ok(mapper.apply(data));
    }
}
