package com.hcltech.frolyk.consumer.stream;

import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ExecutionException;
import java.util.function.Function;

/**
 * Applies an asynchronous function to each upstream element, strictly one at a time.
 * The next upstream element is not drawn until the previous stage has completed.
 */
final class MappedMessageStream<T, R> implements MessageStream<R> {

    private final MessageStream<T> upstream;
    private final Function<? super T, ? extends CompletionStage<? extends R>> fn;

    private final Object monitor = new Object();
    private CompletableFuture<? extends R> inFlight;
    private R pending;
    private boolean hasPending;
    private Throwable failure;

    MappedMessageStream(MessageStream<T> upstream, Function<? super T, ? extends CompletionStage<? extends R>> fn) {
        this.upstream = Objects.requireNonNull(upstream, "upstream");
        this.fn = Objects.requireNonNull(fn, "fn");
    }

    /** An interrupted wait keeps the element in flight; the next call waits for it again. */
    @Override
    public boolean hasNext() throws InterruptedException {
        synchronized (monitor) {
            if (failure != null) throw new StreamFailedException(failure);
            if (hasPending) return true;
            try {
                if (inFlight == null) {
                    if (!upstream.hasNext()) return false;
                    T input = upstream.next();
                    inFlight = Objects.requireNonNull(fn.apply(input), "stage").toCompletableFuture();
                }
                pending = inFlight.get();
                inFlight = null;
                hasPending = true;
                return true;
            } catch (ExecutionException | RuntimeException e) {
                inFlight = null;
                failure = StreamFailedException.unwrap(e);
                throw new StreamFailedException(failure);
            }
        }
    }

    @Override
    public R next() throws InterruptedException {
        synchronized (monitor) {
            if (!hasNext()) throw new NoSuchElementException("stream completed");
            R out = pending;
            pending = null;
            hasPending = false;
            return out;
        }
    }
}
