package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.common.function.ThrowingFunction;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * One step of a processing chain: one input in, one output out, or a failure.
 * Throwing and returning a failed stage are equivalent.
 */
@FunctionalInterface
public interface Processor<I, O> {

    CompletionStage<O> process(I input) throws Exception;

    /** A processor that completes immediately with {@code fn}'s result. */
    static <I, O> Processor<I, O> sync(ThrowingFunction<I, O> fn) {
        return input -> CompletableFuture.completedFuture(fn.apply(input));
    }
}
