package com.hcltech.frolyk.consumer.assignment;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;

/**
 * Left-to-right composition of processors: the output of one is the input of the next.
 * Elements are typed loosely because neighbouring processors agree on types only by convention.
 */
final class ProcessorChain {
    private final List<Processor<Object, Object>> processors;

    ProcessorChain(List<Processor<Object, Object>> processors) {
        this.processors = List.copyOf(processors);
    }

    int size() {
        return processors.size();
    }

    CompletableFuture<Object> apply(Object input) {
        CompletableFuture<Object> stage = CompletableFuture.completedFuture(input);
        for (Processor<Object, Object> processor : processors) {
            stage = stage.thenCompose(value -> invoke(processor, value));
        }
        return stage;
    }

    private static CompletableFuture<Object> invoke(Processor<Object, Object> processor, Object input) {
        try {
            return Objects.requireNonNull(processor.process(input), "processor returned no stage")
                    .toCompletableFuture();
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
