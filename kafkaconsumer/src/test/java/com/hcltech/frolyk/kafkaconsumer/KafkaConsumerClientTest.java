package com.hcltech.frolyk.kafkaconsumer;

import com.hcltech.frolyk.consumer.abstraction.CommitRequest;
import com.hcltech.frolyk.consumer.abstraction.CommittedOffset;
import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.abstraction.PartitionKey;
import com.hcltech.frolyk.consumer.abstraction.StreamsConfig;
import com.hcltech.frolyk.consumer.offset.InvalidOffsetException;
import com.hcltech.frolyk.consumer.registry.PartitionStreamRegistry;
import com.hcltech.frolyk.consumer.stream.MessageStream;
import com.hcltech.frolyk.consumer.stream.StreamFailedException;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.clients.consumer.MockConsumer;
import org.apache.kafka.clients.consumer.OffsetAndMetadata;
import org.apache.kafka.clients.consumer.OffsetResetStrategy;
import org.apache.kafka.common.KafkaException;
import org.apache.kafka.common.TopicPartition;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ThreadFactory;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class KafkaConsumerClientTest {

    private static final Duration TIMEOUT = Duration.ofSeconds(10);
    private static final String TOPIC = "orders";
    private static final String GROUP = "billing";
    private static final PartitionKey P0 = new PartitionKey(TOPIC, 0);
    private static final PartitionKey P1 = new PartitionKey(TOPIC, 1);
    private static final TopicPartition TP0 = new TopicPartition(TOPIC, 0);
    private static final TopicPartition TP1 = new TopicPartition(TOPIC, 1);

    private MockConsumer<byte[], byte[]> mock;
    private KafkaConsumerClient client;

    static StreamsConfig config(int capacity, int resumeThreshold) {
        return new StreamsConfig() {
            @Override public int streamBufferCapacity() { return capacity; }
            @Override public int streamResumeThreshold() { return resumeThreshold; }
            @Override public int pollMs() { return 5; }
            @Override public ThreadFactory threadFactory() {
                return r -> {
                    Thread t = new Thread(r);
                    t.setDaemon(true);
                    return t;
                };
            }
            @Override public String clientId() { return "test"; }
        };
    }

    static ConsumerRecord<byte[], byte[]> record(int partition, long offset, String value) {
        return new ConsumerRecord<>(TOPIC, partition, offset,
                ("key-" + offset).getBytes(StandardCharsets.UTF_8), value.getBytes(StandardCharsets.UTF_8));
    }

    static void await(BooleanSupplier condition, String what) {
        assertTimeoutPreemptively(TIMEOUT, () -> {
            while (!condition.getAsBoolean()) Thread.sleep(5);
        }, what);
    }

    @BeforeEach
    void setUp() {
        mock = new MockConsumer<>(OffsetResetStrategy.EARLIEST);
        client = new KafkaConsumerClient(mock, GROUP, config(1024, 512));
        client.assign(List.of(P0, P1));
        mock.updateBeginningOffsets(Map.of(TP0, 0L, TP1, 0L));
    }

    @AfterEach
    void tearDown() {
        client.close();
    }

    private static List<String> values(List<Message> messages) {
        return messages.stream().map(Message::valueAsString).collect(Collectors.toList());
    }

    @Nested
    class Delivery {
        @Test
        void routesRecordsToTheirPartitionStreams() {
            PartitionStreamRegistry registry = new PartitionStreamRegistry(client, config(1024, 512));
            MessageStream<Message> p0 = registry.stream(P0);
            MessageStream<Message> p1 = registry.stream(P1);
            mock.addRecord(record(0, 0, "a"));
            mock.addRecord(record(1, 0, "b"));
            mock.addRecord(record(0, 1, "c"));

            registry.start().join();

            assertTimeoutPreemptively(TIMEOUT, () -> {
                assertEquals(List.of("a", "c"), values(p0.collect(2)));
                assertEquals(List.of("b"), values(p1.collect(1)));
            });
        }

        @Test
        void pollFailureFailsEveryStream() {
            PartitionStreamRegistry registry = new PartitionStreamRegistry(client, config(1024, 512));
            MessageStream<Message> p0 = registry.stream(P0);
            MessageStream<Message> p1 = registry.stream(P1);
            mock.setPollException(new KafkaException("broker down"));

            registry.start().join();

            assertTimeoutPreemptively(TIMEOUT, () -> {
                assertEquals("broker down", assertThrows(StreamFailedException.class, p0::hasNext).getMessage());
                assertEquals("broker down", assertThrows(StreamFailedException.class, p1::hasNext).getMessage());
            });
        }

        @Test
        void handlerFailureFailsTheFeed() {
            mock.addRecord(record(0, 0, "a"));
            CompletableFuture<Void> feed = client.run(m -> {
                throw new IllegalStateException("handler broke");
            });
            CompletionException e = assertTimeoutPreemptively(TIMEOUT, () -> assertThrows(CompletionException.class, feed::join));
            assertEquals("handler broke", e.getCause().getMessage());
        }

        @Test
        void closeCompletesTheFeedAndClosesTheConsumer() {
            CompletableFuture<Void> feed = client.run(m -> { });
            client.close();
            assertTimeoutPreemptively(TIMEOUT, () -> feed.join());
            assertTrue(mock.closed());
            CompletionException e = assertThrows(CompletionException.class, () -> client.commitOffsets(
                    List.of(new CommitRequest(GROUP, P0, BigInteger.ONE, Optional.empty()))).join());
            assertInstanceOf(IllegalStateException.class, e.getCause());
        }

        @Test
        void runTwiceIsRejected() {
            client.run(m -> { });
            assertThrows(IllegalStateException.class, () -> client.run(m -> { }));
        }
    }

    @Nested
    class Commits {
        @Test
        void commitBeforeRunIsAppliedImmediately() {
            client.commitOffsets(List.of(new CommitRequest(GROUP, P0, BigInteger.valueOf(3), Optional.of("abc")))).join();
            assertEquals(new OffsetAndMetadata(3, "abc"), mock.committed(Set.of(TP0)).get(TP0));
        }

        @Test
        void commitWhileRunningGoesThroughThePollThread() {
            client.run(m -> { });
            assertTimeoutPreemptively(TIMEOUT, () -> client.commitOffsets(List.of(
                    new CommitRequest(GROUP, P0, BigInteger.valueOf(10), Optional.empty()),
                    new CommitRequest(GROUP, P1, BigInteger.valueOf(20), Optional.of("meta")))).join());

            assertEquals(Optional.of(new CommittedOffset(BigInteger.valueOf(10), Optional.empty())),
                    client.committed(GROUP, P0).join());
            assertEquals(Optional.of(new CommittedOffset(BigInteger.valueOf(20), Optional.of("meta"))),
                    client.committed(GROUP, P1).join());
        }

        @Test
        void commitFromThePollThreadRunsAtOnce() {
            CompletableFuture<Optional<CommittedOffset>> seen = new CompletableFuture<>();
            mock.addRecord(record(0, 0, "a"));
            client.run(m -> {
                client.commitOffsets(List.of(new CommitRequest(GROUP, m.partitionKey(), m.offset().add(BigInteger.ONE),
                        Optional.of("from-handler")))).join();
                seen.complete(client.committed(GROUP, m.partitionKey()).join());
            });

            Optional<CommittedOffset> committed = assertTimeoutPreemptively(TIMEOUT, () -> seen.join());
            assertEquals(Optional.of(new CommittedOffset(BigInteger.ONE, Optional.of("from-handler"))), committed);
        }

        @Test
        void nothingCommittedIsEmpty() {
            assertEquals(Optional.empty(), client.committed(GROUP, P0).join());
        }

        @Test
        void otherGroupIsRejected() {
            CompletionException e = assertThrows(CompletionException.class, () -> client.commitOffsets(
                    List.of(new CommitRequest("someone-else", P0, BigInteger.ONE, Optional.empty()))).join());
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
            assertTrue(mock.committed(Set.of(TP0)).isEmpty());
        }

        @Test
        void offsetBeyondKafkaRangeIsRejected() {
            BigInteger huge = BigInteger.valueOf(Long.MAX_VALUE).add(BigInteger.ONE);
            CompletionException e = assertThrows(CompletionException.class, () -> client.commitOffsets(
                    List.of(new CommitRequest(GROUP, P0, huge, Optional.empty()))).join());
            assertInstanceOf(InvalidOffsetException.class, e.getCause());
            assertTrue(e.getCause().getMessage().startsWith("Valid offset is required"));
        }
    }

    @Nested
    class FlowControl {
        @Test
        void pauseBeforeRunIsAppliedImmediately() {
            client.pause(P0);
            assertEquals(Set.of(TP0), mock.paused());
            client.resume(P0);
            assertEquals(Set.of(), mock.paused());
        }

        @Test
        void pauseAndResumeWhileRunningAreAppliedByThePollThread() {
            client.run(m -> { });
            client.pause(P1);
            await(() -> mock.paused().contains(TP1), "partition 1 paused");
            client.resume(P1);
            await(() -> mock.paused().isEmpty(), "partition 1 resumed");
        }

        @Test
        void fullStreamPausesItsPartitionUntilDrained() {
            PartitionStreamRegistry registry = new PartitionStreamRegistry(client, config(2, 0));
            MessageStream<Message> p0 = registry.stream(P0);
            for (int i = 0; i < 3; i++) mock.addRecord(record(0, i, "v" + i));

            registry.start().join();
            await(() -> mock.paused().contains(TP0), "partition 0 paused");

            assertTimeoutPreemptively(TIMEOUT, () -> assertEquals(List.of("v0", "v1", "v2"), values(p0.collect(3))));
            await(() -> !mock.paused().contains(TP0), "partition 0 resumed");
        }
    }
}
