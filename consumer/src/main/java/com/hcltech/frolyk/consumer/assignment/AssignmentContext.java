package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.consumer.stream.MessageStream;

import java.util.Objects;
import java.util.function.Supplier;

/**
 * A ready assignment pipeline: the processed stream and the assignment it commits for.
 *
 * @param <T> output type of the last processor
 */
public final class AssignmentContext<T> {
    private final MessageStream<T> stream;
    private final AssignmentWithCommit assignment;
    private final Supplier<PipelineState> state;

    AssignmentContext(MessageStream<T> stream, AssignmentWithCommit assignment, Supplier<PipelineState> state) {
        this.stream = Objects.requireNonNull(stream, "stream");
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.state = Objects.requireNonNull(state, "state");
    }

    public MessageStream<T> stream() {
        return stream;
    }

    public AssignmentWithCommit assignment() {
        return assignment;
    }

    public PipelineState state() {
        return state.get();
    }
}
