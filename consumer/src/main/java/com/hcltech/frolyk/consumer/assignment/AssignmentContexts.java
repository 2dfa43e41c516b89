package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.consumer.abstraction.ConsumerClient;
import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.stream.MessageStream;
import com.hcltech.frolyk.consumer.stream.StreamFailedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Builds assignment pipelines.
 *
 * <p>The factories run once, in order, each one only after the previous one has resolved. Their
 * processors are then applied left to right to every message of the partition stream, one message
 * at a time, so the output preserves the input order one-to-one. The first failure of any processor
 * fails the output stream at that message; nothing is skipped.
 */
public final class AssignmentContexts {
    private static final Logger log = LoggerFactory.getLogger(AssignmentContexts.class);

    private AssignmentContexts() {
    }

    /**
     * @param assignment the topic, partition and group this pipeline processes and commits for
     * @param stream     the partition stream of the assignment, usually from a
     *                   {@link com.hcltech.frolyk.consumer.registry.StreamRegistry}
     * @param processors factories in chain order; may be empty, in which case messages pass through
     * @param client     receives the commits
     * @param <T>        output type of the last processor, {@link Message} if there are none
     * @return the context once every factory has resolved; fails with the first factory's failure
     */
    public static <T> CompletableFuture<AssignmentContext<T>> create(Assignment assignment,
                                                                     MessageStream<Message> stream,
                                                                     List<? extends ProcessorFactory<?, ?>> processors,
                                                                     ConsumerClient client) {
        Objects.requireNonNull(assignment, "assignment");
        Objects.requireNonNull(stream, "stream");
        Objects.requireNonNull(processors, "processors");
        Objects.requireNonNull(client, "client");

        AtomicReference<PipelineState> state = new AtomicReference<>(PipelineState.CONSTRUCTING);
        AssignmentWithCommit withCommit = new AssignmentWithCommit(assignment, client);

        CompletableFuture<List<Processor<Object, Object>>> built = CompletableFuture.completedFuture(new ArrayList<>());
        for (ProcessorFactory<?, ?> factory : List.copyOf(processors)) {
            built = built.thenCompose(chain -> initialise(factory, withCommit).thenApply(p -> {
                chain.add(p);
                return chain;
            }));
        }

        CompletableFuture<AssignmentContext<T>> result = new CompletableFuture<>();
        built.whenComplete((chain, error) -> {
            if (error != null) {
                Throwable cause = StreamFailedException.unwrap(error);
                state.set(PipelineState.FAILED);
                log.error("Failed to set up pipeline for {}", assignment, cause);
                result.completeExceptionally(cause);
                return;
            }
            ProcessorChain processorChain = new ProcessorChain(chain);
            @SuppressWarnings("unchecked")
            MessageStream<T> output = (MessageStream<T>) stream.mapAsync(processorChain::apply);
            state.set(PipelineState.READY);
            log.info("Pipeline for {} ready with {} processor(s)", assignment, processorChain.size());
            result.complete(new AssignmentContext<>(new StateTrackingStream<>(output, state, assignment), withCommit, state::get));
        });
        return result;
    }

    @SuppressWarnings("unchecked")
    private static CompletableFuture<Processor<Object, Object>> initialise(ProcessorFactory<?, ?> factory,
                                                                         AssignmentWithCommit assignment) {
        try {
            return Objects.requireNonNull(factory.create(assignment), "processor factory returned no stage")
                    .toCompletableFuture()
                    .thenApply(p -> (Processor<Object, Object>) (Processor<?, ?>) Objects.requireNonNull(p, "processor factory returned no processor"));
        } catch (Exception e) {
            return CompletableFuture.failedFuture(e);
        }
    }
}
