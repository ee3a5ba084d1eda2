package com.strumbot.util;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for working with {@link java.util.concurrent.CompletableFuture} failures.
 */
public final class FutureUtils {

    private FutureUtils() {
    }

    /**
     * Strip the completion wrappers added by {@code CompletableFuture} stages.
     */
    public static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
