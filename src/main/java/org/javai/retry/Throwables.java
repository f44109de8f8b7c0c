package org.javai.retry;

import org.javai.retry.classify.DefaultExceptionClassifier;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

final class Throwables {

    private Throwables() {
        // Utility class
    }

    /**
     * Strips the wrappers that {@code CompletableFuture} puts around the real failure.
     */
    static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    /**
     * Rethrows errors the process cannot recover from; returns normally for anything else.
     */
    static void rethrowIfUnrecoverable(Throwable error) {
        if (DefaultExceptionClassifier.isUnrecoverable(error)) {
            throw (Error) error;
        }
    }
}
