package com.github.yoep.debrid.core.utils;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

public class FutureUtils {
    private FutureUtils() {
    }

    /**
     * Retrieve the actual cause of a failed future.
     *
     * @param throwable The throwable to unwrap.
     * @return Returns the first cause which isn't a {@link CompletionException} or {@link ExecutionException}.
     */
    public static Throwable unwrap(Throwable throwable) {
        var cause = throwable;

        while ((cause instanceof CompletionException || cause instanceof ExecutionException) && cause.getCause() != null) {
            cause = cause.getCause();
        }

        return cause;
    }

    /**
     * Invoke the given async action and convert any synchronously thrown exception or missing future into a failed future.
     *
     * @param action The action to invoke.
     * @param <T>    The result type of the action.
     * @return Returns the future of the action.
     */
    public static <T> CompletableFuture<T> invoke(Supplier<CompletableFuture<T>> action) {
        Objects.requireNonNull(action, "action cannot be null");
        try {
            var future = action.get();

            if (future == null) {
                return CompletableFuture.failedFuture(new IllegalStateException("action returned no future"));
            }

            return future;
        } catch (RuntimeException ex) {
            return CompletableFuture.failedFuture(ex);
        }
    }
}
