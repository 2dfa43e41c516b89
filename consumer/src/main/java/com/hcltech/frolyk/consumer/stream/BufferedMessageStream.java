package com.hcltech.frolyk.consumer.stream;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Channel between one writer (the delivery loop) and its reader.
 *
 * <p>Writes never block: the buffer is bounded softly, by asking the {@link Backpressure} to pause the
 * source when {@code capacity} elements are waiting and to resume it once the reader has drained the
 * buffer down to {@code resumeThreshold}. Elements already buffered are still delivered after a
 * terminal failure; the failure is observed once they are gone.
 */
public final class BufferedMessageStream<T> implements MessageStream<T> {

    private final ReentrantLock lock = new ReentrantLock();
    private final Condition changed = lock.newCondition();
    private final Deque<T> buffer = new ArrayDeque<>();

    private final int capacity;
    private final int resumeThreshold;
    private final Backpressure backpressure;

    private boolean paused;
    private boolean completed;
    private Throwable failure;

    public BufferedMessageStream() {
        this(Integer.MAX_VALUE, 0, Backpressure.NONE);
    }

    public BufferedMessageStream(int capacity, int resumeThreshold, Backpressure backpressure) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1, was " + capacity);
        this.capacity = capacity;
        this.resumeThreshold = Math.max(0, Math.min(resumeThreshold, capacity - 1));
        this.backpressure = Objects.requireNonNull(backpressure, "backpressure");
    }

    /**
     * Appends an element.
     *
     * @return false if the stream has already ended; the element is discarded
     */
    public boolean offer(T element) {
        Objects.requireNonNull(element, "element");
        lock.lock();
        try {
            if (isTerminated()) return false;
            buffer.addLast(element);
            if (!paused && buffer.size() >= capacity) {
                paused = true;
                backpressure.pause();
            }
            changed.signalAll();
            return true;
        } finally {
            lock.unlock();
        }
    }

    /** Ends the stream normally. No-op once ended. */
    public void complete() {
        lock.lock();
        try {
            if (isTerminated()) return;
            completed = true;
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    /** Ends the stream with {@code cause}. No-op once ended. */
    public void fail(Throwable cause) {
        Objects.requireNonNull(cause, "cause");
        lock.lock();
        try {
            if (isTerminated()) return;
            failure = StreamFailedException.unwrap(cause);
            changed.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean hasNext() throws InterruptedException {
        lock.lock();
        try {
            return awaitElement();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T next() throws InterruptedException {
        lock.lock();
        try {
            if (!awaitElement()) throw new NoSuchElementException("stream completed");
            T element = buffer.pollFirst();
            if (paused && buffer.size() <= resumeThreshold) {
                paused = false;
                backpressure.resume();
            }
            return element;
        } finally {
            lock.unlock();
        }
    }

    /** Number of buffered elements. */
    public int size() {
        lock.lock();
        try {
            return buffer.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isPaused() {
        lock.lock();
        try {
            return paused;
        } finally {
            lock.unlock();
        }
    }

    // lock held
    private boolean awaitElement() throws InterruptedException {
        while (buffer.isEmpty() && !isTerminated()) {
            changed.await();
        }
        if (!buffer.isEmpty()) return true;
        if (failure != null) throw new StreamFailedException(failure);
        return false;
    }

    // lock held
    private boolean isTerminated() {
        return completed || failure != null;
    }
}
