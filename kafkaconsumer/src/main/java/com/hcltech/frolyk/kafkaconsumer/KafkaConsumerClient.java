package com.hcltech.frolyk.kafkaconsumer;

import com.hcltech.frolyk.consumer.abstraction.CommitRequest;
import com.hcltech.frolyk.consumer.abstraction.CommittedOffset;
import com.hcltech.frolyk.consumer.abstraction.ConsumerClient;
import com.hcltech.frolyk.consumer.abstraction.MessageHandler;
import com.hcltech.frolyk.consumer.abstraction.PartitionKey;
import com.hcltech.frolyk.consumer.abstraction.StreamsConfig;
import com.hcltech.frolyk.consumer.offset.InvalidOffsetException;
import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.clients.consumer.ConsumerRebalanceListener;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.ConsumerRecords;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.errors.WakeupException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.time.Duration;
import java.util.Collection;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ThreadFactory;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * {@link ConsumerClient} over a Kafka {@link Consumer}.
 *
 * <p>Kafka consumers are single-threaded. Once {@link #run} has started the poll loop, only the loop
 * thread touches the consumer: commits and committed-offset lookups from other threads are queued
 * and executed between polls, and pause/resume requests are applied before each poll. Futures of
 * queued commands complete on the loop thread, so their continuations may commit again; such calls
 * run at once. Before the loop starts and after it has ended, those calls run on the caller's thread.
 */
public final class KafkaConsumerClient implements ConsumerClient {
    private static final Logger log = LoggerFactory.getLogger(KafkaConsumerClient.class);
    private static final long CLOSE_TIMEOUT_MS = 30_000;

    private final Consumer<byte[], byte[]> consumer;
    private final String groupId;
    private final Duration pollTimeout;
    private final ThreadFactory threadFactory;
    private final String clientId;

    private final Queue<Command> commands = new ConcurrentLinkedQueue<>();
    private final PauseResumeApplier pauser = new PauseResumeApplier();
    private final CompletableFuture<Void> feed = new CompletableFuture<>();

    private final Object lifecycle = new Object();
    private Thread loopThread;    // guarded by lifecycle
    private boolean loopActive;   // guarded by lifecycle
    private boolean closed;       // guarded by lifecycle
    private volatile boolean running;

    /**
     * @param groupId the group the consumer was configured with; commits for any other group are rejected
     */
    public KafkaConsumerClient(Consumer<byte[], byte[]> consumer, String groupId, StreamsConfig config) {
        this.consumer = Objects.requireNonNull(consumer, "consumer");
        this.groupId = Objects.requireNonNull(groupId, "groupId");
        Objects.requireNonNull(config, "config");
        this.pollTimeout = Duration.ofMillis(Math.max(1, config.pollMs()));
        this.threadFactory = Objects.requireNonNull(config.threadFactory(), "threadFactory");
        this.clientId = Objects.requireNonNull(config.clientId(), "clientId");
    }

    /** Subscribe to {@code topics} with group management. Before {@link #run} only. */
    public void subscribe(Collection<String> topics) {
        synchronized (lifecycle) {
            ensureNotStarted();
            consumer.subscribe(List.copyOf(topics), new LoggingRebalanceListener());
            log.info("[{}] Subscribed to {}", clientId, topics);
        }
    }

    /** Assign partitions manually, without group management. Before {@link #run} only. */
    public void assign(Collection<PartitionKey> partitions) {
        synchronized (lifecycle) {
            ensureNotStarted();
            consumer.assign(partitions.stream().map(KafkaMessages::topicPartition).toList());
            log.info("[{}] Assigned {}", clientId, partitions);
        }
    }

    @Override
    public CompletableFuture<Void> run(MessageHandler handler) {
        Objects.requireNonNull(handler, "handler");
        synchronized (lifecycle) {
            ensureNotStarted();
            running = true;
            loopActive = true;
            loopThread = threadFactory.newThread(() -> loop(handler));
            loopThread.setName("poll-" + clientId);
            loopThread.start();
        }
        log.info("[{}] Poll loop started", clientId);
        return feed;
    }

    @Override
    public CompletableFuture<Void> commitOffsets(List<CommitRequest> commits) {
        Map<TopicPartition, OffsetAndMetadata> offsets;
        try {
            offsets = toKafkaOffsets(commits);
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
        if (offsets.isEmpty()) return CompletableFuture.completedFuture(null);
        return submit(c -> {
            c.commitSync(offsets);
            log.debug("[{}] Committed {}", clientId, offsets);
            return null;
        });
    }

    /** Kafka stores absent metadata as an empty string; both are reported as absent. */
    @Override
    public CompletableFuture<Optional<CommittedOffset>> committed(String group, PartitionKey partition) {
        try {
            checkGroup(group);
        } catch (IllegalArgumentException e) {
            return CompletableFuture.failedFuture(e);
        }
        TopicPartition tp = KafkaMessages.topicPartition(partition);
        return submit(c -> {
            OffsetAndMetadata om = c.committed(Set.of(tp)).get(tp);
            return Optional.ofNullable(om).map(o -> new CommittedOffset(
                    BigInteger.valueOf(o.offset()),
                    Optional.ofNullable(o.metadata()).filter(m -> !m.isEmpty())));
        });
    }

    @Override
    public void pause(PartitionKey partition) {
        pauser.requestPause(KafkaMessages.topicPartition(partition));
        applyPausesIfIdle();
    }

    @Override
    public void resume(PartitionKey partition) {
        pauser.requestResume(KafkaMessages.topicPartition(partition));
        applyPausesIfIdle();
    }

    /** Stops the poll loop, waits for it and closes the consumer. Idempotent. */
    @Override
    public void close() {
        Thread thread;
        synchronized (lifecycle) {
            if (closed) return;
            closed = true;
            running = false;
            thread = loopThread;
        }
        if (thread != null) {
            consumer.wakeup();
            if (thread != Thread.currentThread()) awaitLoop(thread);
        }
        synchronized (lifecycle) {
            failPendingCommands();
            pauser.clear();
            consumer.close();
        }
        feed.complete(null);
        log.info("[{}] Closed", clientId);
    }

    // ---------------- poll loop ----------------

    private void loop(MessageHandler handler) {
        Throwable failure = null;
        try {
            while (running) {
                runCommands();
                pauser.apply(consumer);
                ConsumerRecords<byte[], byte[]> records;
                try {
                    records = consumer.poll(pollTimeout);
                } catch (WakeupException e) {
                    continue; // close() requested; running is re-checked
                }
                for (ConsumerRecord<byte[], byte[]> r : records) {
                    handler.onMessage(KafkaMessages.toMessage(r));
                }
            }
        } catch (Exception e) {
            failure = e;
            log.error("[{}] Poll loop failed", clientId, e);
        } finally {
            synchronized (lifecycle) {
                loopActive = false;
                runCommands();
            }
        }
        if (failure != null) feed.completeExceptionally(failure);
        else feed.complete(null);
        log.info("[{}] Poll loop stopped", clientId);
    }

    private <T> CompletableFuture<T> submit(Function<Consumer<byte[], byte[]>, T> action) {
        CompletableFuture<T> result = new CompletableFuture<>();
        Command command = new Command() {
            @Override
            public void run() {
                try {
                    result.complete(action.apply(consumer));
                } catch (RuntimeException e) {
                    result.completeExceptionally(e);
                }
            }

            @Override
            public void fail(Throwable cause) {
                result.completeExceptionally(cause);
            }
        };
        synchronized (lifecycle) {
            if (loopActive && Thread.currentThread() == loopThread) {
                // continuation of a command completed by the loop; the queue would not be drained
                command.run();
            } else if (loopActive) {
                commands.add(command);
            } else if (closed) {
                command.fail(closedError());
            } else {
                command.run();
            }
        }
        return result;
    }

    private void runCommands() {
        Command command;
        while ((command = commands.poll()) != null) {
            command.run();
        }
    }

    /** Only left over if the loop did not stop in time. */
    private void failPendingCommands() {
        Command command;
        while ((command = commands.poll()) != null) {
            command.fail(closedError());
        }
    }

    private IllegalStateException closedError() {
        return new IllegalStateException("consumer client " + clientId + " is closed");
    }

    private void applyPausesIfIdle() {
        synchronized (lifecycle) {
            if (!loopActive && !closed) pauser.apply(consumer);
        }
    }

    private void awaitLoop(Thread thread) {
        try {
            thread.join(CLOSE_TIMEOUT_MS);
            if (thread.isAlive()) log.warn("[{}] Poll loop did not stop within {} ms", clientId, CLOSE_TIMEOUT_MS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private Map<TopicPartition, OffsetAndMetadata> toKafkaOffsets(List<CommitRequest> commits) {
        Map<TopicPartition, OffsetAndMetadata> out = new HashMap<>();
        for (CommitRequest c : commits) {
            checkGroup(c.group());
            long offset;
            try {
                offset = c.offset().longValueExact();
            } catch (ArithmeticException e) {
                throw new InvalidOffsetException("Valid offset is required, " + c.offset() + " is beyond the range of a Kafka offset");
            }
            out.put(KafkaMessages.topicPartition(c.partitionKey()), new OffsetAndMetadata(offset, c.metadata().orElse(null)));
        }
        return out;
    }

    private void checkGroup(String group) {
        if (!groupId.equals(group)) {
            throw new IllegalArgumentException("consumer " + clientId + " belongs to group " + groupId + ", not " + group);
        }
    }

    // lifecycle held
    private void ensureNotStarted() {
        if (closed) throw closedError();
        if (loopThread != null) throw new IllegalStateException("consumer client " + clientId + " is already running");
    }

    /** Work for the poll thread; completes its own future. */
    private interface Command extends Runnable {
        void fail(Throwable cause);
    }

    private final class LoggingRebalanceListener implements ConsumerRebalanceListener {
        @Override
        public void onPartitionsRevoked(Collection<TopicPartition> partitions) {
            log.info("[{}] Revoked {}", clientId, partitions);
        }

        @Override
        public void onPartitionsAssigned(Collection<TopicPartition> partitions) {
            log.info("[{}] Assigned {}", clientId,
                    partitions.stream().map(KafkaMessages::partitionKey).collect(Collectors.toList()));
        }
    }
}
