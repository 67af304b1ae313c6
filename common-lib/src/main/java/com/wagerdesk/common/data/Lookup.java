package com.wagerdesk.common.data;

import java.util.function.Function;

/**
 * Result of one DataAccess call: either a record or an explicit "not found" with a reason.
 */
public record Lookup<T>(T value, String reason) {

    public static <T> Lookup<T> found(T value) {
        if (value == null) throw new IllegalArgumentException("found() requires a value");
        return new Lookup<>(value, null);
    }

    public static <T> Lookup<T> notFound(String reason) {
        return new Lookup<>(null, reason == null ? "not found" : reason);
    }

    public boolean isFound() {
        return value != null;
    }

    public T orElse(T fallback) {
        return value != null ? value : fallback;
    }

    public <R> Lookup<R> map(Function<T, R> mapper) {
        return value != null ? found(mapper.apply(value)) : notFound(reason);
    }
}
