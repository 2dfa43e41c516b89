package com.hcltech.frolyk.kafkaconsumer;

import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.assignment.Assignment;
import com.hcltech.frolyk.consumer.assignment.AssignmentContext;
import com.hcltech.frolyk.consumer.assignment.AssignmentContexts;
import com.hcltech.frolyk.consumer.assignment.Processor;
import com.hcltech.frolyk.consumer.assignment.ProcessorFactory;
import com.hcltech.frolyk.consumer.registry.PartitionStreamRegistry;
import com.hcltech.frolyk.consumer.stream.MessageStream;
import com.hcltech.frolyk.consumer.stream.StreamFailedException;
import org.apache.kafka.clients.consumer.KafkaConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * Demo: one pipeline per configured partition that logs each message and commits after it.
 */
public class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static void main(String[] args) throws Exception {
        // 1) Load config
        AppConfig cfg = AppConfig.load();

        // 2) Kafka consumer + client
        KafkaConsumer<byte[], byte[]> consumer = new KafkaConsumer<>(cfg.kafkaProperties());
        KafkaConsumerClient client = new KafkaConsumerClient(consumer, cfg.groupId(), cfg);
        client.subscribe(List.of(cfg.topic()));

        // 3) Registry + one pipeline per partition
        PartitionStreamRegistry registry = new PartitionStreamRegistry(client, cfg);
        List<Thread> workers = new ArrayList<>();
        for (int partition : cfg.partitions()) {
            Assignment assignment = new Assignment(cfg.topic(), partition, cfg.groupId());
            AssignmentContext<Message> context = AssignmentContexts.<Message>create(
                    assignment,
                    registry.stream(assignment.partitionKey()),
                    List.of(logging(), commitAfterEach()),
                    client).get();
            Thread t = cfg.threadFactory().newThread(() -> drain(assignment, context.stream()));
            t.setName("pipeline-" + assignment.partitionKey());
            workers.add(t);
        }

        // 4) Run
        registry.start().get();
        workers.forEach(Thread::start);

        // 5) Shutdown
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            log.info("Shutdown requested");
            registry.close();
        }));
        for (Thread t : workers) t.join();
    }

    static ProcessorFactory<Message, Message> logging() {
        return ProcessorFactory.of(Processor.<Message, Message>sync(m -> {
            log.info("{} key={} value={}", m, m.keyAsString(), m.valueAsString());
            return m;
        }));
    }

    static ProcessorFactory<Message, Message> commitAfterEach() {
        return assignment -> CompletableFuture.<Processor<Message, Message>>completedFuture(
                m -> assignment.commitOffset(m.offset().add(BigInteger.ONE)).thenApply(v -> m));
    }

    private static void drain(Assignment assignment, MessageStream<Message> stream) {
        try {
            while (stream.hasNext()) stream.next();
            log.info("Pipeline {} finished", assignment);
        } catch (StreamFailedException e) {
            log.error("Pipeline {} failed", assignment, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }
}
