package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.consumer.stream.MessageStream;
import com.hcltech.frolyk.consumer.stream.StreamFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicReference;

/** Moves the pipeline to COMPLETED or FAILED as its output stream ends. */
final class StateTrackingStream<T> implements MessageStream<T> {
    private static final Logger log = LoggerFactory.getLogger(StateTrackingStream.class);

    private final MessageStream<T> delegate;
    private final AtomicReference<PipelineState> state;
    private final Assignment assignment;

    StateTrackingStream(MessageStream<T> delegate, AtomicReference<PipelineState> state, Assignment assignment) {
        this.delegate = delegate;
        this.state = state;
        this.assignment = assignment;
    }

    @Override
    public boolean hasNext() throws InterruptedException {
        try {
            boolean more = delegate.hasNext();
            if (!more && state.compareAndSet(PipelineState.READY, PipelineState.COMPLETED)) {
                log.info("Pipeline for {} completed", assignment);
            }
            return more;
        } catch (StreamFailedException e) {
            if (state.compareAndSet(PipelineState.READY, PipelineState.FAILED)) {
                log.error("Pipeline for {} failed: {}", assignment, e.getMessage(), e.getCause());
            }
            throw e;
        }
    }

    @Override
    public T next() throws InterruptedException {
        // hasNext() records the terminal state before next() reports it
        hasNext();
        return delegate.next();
    }
}
