package com.hcltech.frolyk.consumer.registry;

import com.hcltech.frolyk.consumer.abstraction.ConsumerClient;
import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.abstraction.PartitionKey;
import com.hcltech.frolyk.consumer.abstraction.StreamsConfig;
import com.hcltech.frolyk.consumer.stream.Backpressure;
import com.hcltech.frolyk.consumer.stream.BufferedMessageStream;
import com.hcltech.frolyk.consumer.stream.MessageStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link StreamRegistry} over a {@link ConsumerClient}.
 *
 * <p>The registry is the only writer of the routing table and of the partition streams; readers only
 * pull from the streams they were handed. A partition whose stream holds {@code streamBufferCapacity}
 * unread messages is paused at the client and resumed once drained to {@code streamResumeThreshold}.
 *
 * <p>When the feed ends every stream ends with it: failed if the feed failed, completed otherwise.
 */
public final class PartitionStreamRegistry implements StreamRegistry {
    private static final Logger log = LoggerFactory.getLogger(PartitionStreamRegistry.class);

    private final ConsumerClient client;
    private final PartitionTable<BufferedMessageStream<Message>> table;
    private final AtomicReference<CompletableFuture<Void>> started = new AtomicReference<>();

    /** Streams requested after the feed ended inherit its terminal state. feedFailure is written first. */
    private volatile Throwable feedFailure;
    private volatile boolean feedEnded;

    public PartitionStreamRegistry(ConsumerClient client) {
        this(client, StreamsConfig.defaults());
    }

    public PartitionStreamRegistry(ConsumerClient client, StreamsConfig config) {
        this.client = Objects.requireNonNull(client, "client");
        Objects.requireNonNull(config, "config");
        int capacity = Math.max(1, config.streamBufferCapacity());
        int resumeThreshold = config.streamResumeThreshold();
        this.table = new PartitionTable<>(key -> newStream(key, capacity, resumeThreshold));
    }

    @Override
    public MessageStream<Message> stream(PartitionKey key) {
        BufferedMessageStream<Message> stream = table.getOrCreate(key);
        if (feedEnded) endLikeFeed(stream);
        return stream;
    }

    @Override
    public CompletableFuture<Void> start() {
        CompletableFuture<Void> opened = new CompletableFuture<>();
        if (!started.compareAndSet(null, opened)) return started.get();
        try {
            client.run(this::route).whenComplete((ok, error) -> onFeedEnded(error));
            log.info("Stream registry started");
            opened.complete(null);
        } catch (RuntimeException e) {
            log.error("Failed to open the consumer feed", e);
            opened.completeExceptionally(e);
        }
        return opened;
    }

    @Override
    public void close() {
        client.close();
    }

    private void route(Message message) {
        table.getOrCreate(message.partitionKey()).offer(message);
    }

    private void onFeedEnded(Throwable error) {
        feedFailure = error;
        feedEnded = true;
        if (error != null) {
            log.error("Consumer feed failed; failing {} partition stream(s)", table.keys().size(), error);
            table.values().forEach(s -> s.fail(error));
        } else {
            log.info("Consumer feed ended; completing {} partition stream(s)", table.keys().size());
            table.values().forEach(BufferedMessageStream::complete);
        }
    }

    private BufferedMessageStream<Message> newStream(PartitionKey key, int capacity, int resumeThreshold) {
        log.debug("Created stream for {}", key);
        return new BufferedMessageStream<>(capacity, resumeThreshold, new PartitionBackpressure(client, key));
    }

    private void endLikeFeed(BufferedMessageStream<Message> stream) {
        Throwable failure = feedFailure;
        if (failure != null) stream.fail(failure);
        else stream.complete();
    }

    /** Pauses and resumes one partition at the client. */
    private record PartitionBackpressure(ConsumerClient client, PartitionKey key) implements Backpressure {
        @Override
        public void pause() {
            log.debug("Pausing {}: stream buffer full", key);
            client.pause(key);
        }

        @Override
        public void resume() {
            log.debug("Resuming {}: stream buffer drained", key);
            client.resume(key);
        }
    }
}
