package com.hcltech.frolyk.consumer.stream;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Lazy, pull-driven, ordered sequence. Possibly unbounded.
 *
 * <p>Draining is destructive: an element handed to one reader is gone for every other reader, so a
 * stream is meant to have a single reader. A failed stream stays failed: every later draw throws
 * {@link StreamFailedException} with the same cause.
 *
 * @param <T> element type; elements may be null
 */
public interface MessageStream<T> {

    /**
     * Blocks until an element is available or the stream has ended.
     *
     * @return false once the stream has completed and every element has been drawn
     * @throws StreamFailedException if the stream failed
     */
    boolean hasNext() throws InterruptedException;

    /**
     * Blocks until the next element is available and removes it.
     *
     * @throws java.util.NoSuchElementException if the stream completed
     * @throws StreamFailedException            if the stream failed
     */
    T next() throws InterruptedException;

    /** Draws up to {@code n} elements; fewer only if the stream completes first. */
    default List<T> collect(int n) throws InterruptedException {
        if (n < 0) throw new IllegalArgumentException("n must be >= 0, was " + n);
        List<T> out = new ArrayList<>(Math.min(n, 1024));
        while (out.size() < n && hasNext()) {
            out.add(next());
        }
        return out;
    }

    /** {@link #collect(int)} on {@code executor}. A failure of the stream fails the future. */
    default CompletableFuture<List<T>> collectAsync(int n, Executor executor) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return collect(n);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                throw new CompletionException(e);
            }
        }, executor);
    }

    /**
     * Lazily applies {@code fn} to every element, one element in flight at a time.
     * The first failed stage fails the returned stream at that element's position.
     */
    default <R> MessageStream<R> mapAsync(Function<? super T, ? extends CompletionStage<? extends R>> fn) {
        return new MappedMessageStream<>(this, fn);
    }
}
