package com.hcltech.frolyk.consumer.assignment;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Builds a {@link Processor} for an assignment. Called once, when the assignment context is created.
 * A factory may commit through the assignment before returning its processor.
 */
@FunctionalInterface
public interface ProcessorFactory<I, O> {

    CompletionStage<? extends Processor<I, O>> create(AssignmentWithCommit assignment) throws Exception;

    /** A factory that needs no setup. */
    static <I, O> ProcessorFactory<I, O> of(Processor<I, O> processor) {
        return assignment -> CompletableFuture.completedFuture(processor);
    }
}
