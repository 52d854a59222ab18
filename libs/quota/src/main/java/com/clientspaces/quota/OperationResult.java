package com.clientspaces.quota;

import java.util.function.Function;

/**
 * Either the value of a successful protected operation or its {@link OperationError}.
 */
public record OperationResult<T>(T value, OperationError error) {

    public static <T> OperationResult<T> success(T value) {
        return new OperationResult<>(value, null);
    }

    public static <T> OperationResult<T> failure(OperationError error) {
        if (error == null) {
            throw new IllegalArgumentException("error must not be null");
        }
        return new OperationResult<>(null, error);
    }

    public boolean isSuccess() {
        return error == null;
    }

    public <R> OperationResult<R> map(Function<? super T, ? extends R> mapper) {
        return isSuccess() ? success(mapper.apply(value)) : failure(error);
    }
}
