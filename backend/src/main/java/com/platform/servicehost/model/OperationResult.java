package com.platform.servicehost.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.servicehost.error.ErrorCode;

import java.util.Optional;

/**
 * Outcome of a lifecycle operation. Expected failures are reported here, never thrown.
 *
 * @param <T> payload carried on success (the affected record, usually)
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult<T>(
    boolean success,
    OperationType operation,
    String serviceId,
    ErrorCode errorCode,
    String message,
    String detail,
    long elapsedMs,
    T value
) {

    public static <T> OperationResult<T> success(OperationType operation, String serviceId, String message, T value) {
        return new OperationResult<>(true, operation, serviceId, null, message, null, 0, value);
    }

    public static <T> OperationResult<T> failure(OperationType operation, String serviceId,
                                                 ErrorCode errorCode, String message) {
        return new OperationResult<>(false, operation, serviceId, errorCode, message, null, 0, null);
    }

    public static <T> OperationResult<T> failure(OperationType operation, String serviceId,
                                                 ErrorCode errorCode, String message, String detail) {
        return new OperationResult<>(false, operation, serviceId, errorCode, message, detail, 0, null);
    }

    public OperationResult<T> withElapsedMs(long elapsed) {
        return new OperationResult<>(success, operation, serviceId, errorCode, message, detail, elapsed, value);
    }

    public OperationResult<T> withDetail(String newDetail) {
        return new OperationResult<>(success, operation, serviceId, errorCode, message, newDetail, elapsedMs, value);
    }

    public <U> OperationResult<U> withValue(U newValue) {
        return new OperationResult<>(success, operation, serviceId, errorCode, message, detail, elapsedMs, newValue);
    }

    /**
     * Re-labels a failure under another operation, e.g. a Stop failure surfacing from Restart.
     */
    public <U> OperationResult<U> asFailureOf(OperationType outer) {
        return new OperationResult<>(false, outer, serviceId, errorCode, message, detail, elapsedMs, null);
    }

    public Optional<T> valueIfPresent() {
        return Optional.ofNullable(value);
    }

    public boolean isFailure() {
        return !success;
    }
}
