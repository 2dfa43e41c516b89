package com.hcltech.frolyk.consumer.abstraction;

import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Broker-agnostic view of the consumer this layer sits on.
 * Connection, subscription and group membership are the adapter's business.
 *
 * <p>Implementations must accept {@link #commitOffsets}, {@link #committed}, {@link #pause} and
 * {@link #resume} from any thread while {@link #run} is delivering.
 */
public interface ConsumerClient extends AutoCloseable {

    /**
     * Start delivering the feed to {@code handler}, one message at a time, in the order the broker
     * returned them. May be called once.
     *
     * @return completes when the feed ends: normally on {@link #close()}, exceptionally when the
     * delivery loop fails (including a failure thrown by the handler)
     */
    CompletableFuture<Void> run(MessageHandler handler);

    /** Record the given positions. The future fails if the client rejects the commit. */
    CompletableFuture<Void> commitOffsets(List<CommitRequest> commits);

    /** The last committed position of {@code group} on {@code partition}, if any. */
    CompletableFuture<Optional<CommittedOffset>> committed(String group, PartitionKey partition);

    /** Stop fetching {@code partition} until {@link #resume} is called. */
    void pause(PartitionKey partition);

    void resume(PartitionKey partition);

    /** Disconnect. Ends the feed. */
    @Override
    void close();
}
