package com.hcltech.frolyk.consumer.stream;

import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/** Thrown when drawing from a stream that has failed. The cause is the original failure. */
public class StreamFailedException extends RuntimeException {

    public StreamFailedException(Throwable cause) {
        super(messageOf(unwrap(cause)), unwrap(cause));
    }

    /** Strips the wrappers added by {@link java.util.concurrent.CompletableFuture}. */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof CompletionException || current instanceof ExecutionException
                || current instanceof StreamFailedException) && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }

    private static String messageOf(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.toString();
    }
}
