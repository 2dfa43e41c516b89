package com.hcltech.frolyk.consumer.registry;

import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.abstraction.PartitionKey;
import com.hcltech.frolyk.consumer.stream.MessageStream;

import java.util.concurrent.CompletableFuture;

/**
 * Splits the feed of one consumer into one stream per partition.
 */
public interface StreamRegistry extends AutoCloseable {

    /**
     * The stream of {@code key}, created on first request. The same key always yields the same
     * stream; distinct keys yield distinct streams. May be called before {@link #start()}.
     */
    MessageStream<Message> stream(PartitionKey key);

    /**
     * Starts routing the consumer's feed into the partition streams. Only the first call opens the
     * feed; later calls return the same future.
     *
     * @return completes once the feed has been opened
     */
    CompletableFuture<Void> start();

    @Override
    void close();
}
