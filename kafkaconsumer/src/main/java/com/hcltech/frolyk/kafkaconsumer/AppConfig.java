package com.hcltech.frolyk.kafkaconsumer;

import com.hcltech.frolyk.consumer.abstraction.StreamsConfig;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.Properties;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;

/**
 * AppConfig:
 *  - Implements StreamsConfig (buffer capacity, resume threshold, poll interval, threads)
 *  - Exposes Kafka-specific Properties (bootstrap.servers, group.id, client.id)
 *  - Loads from application.properties on the classpath.
 */
public final class AppConfig implements StreamsConfig {

    private final Properties props;

    private AppConfig(Properties props) {
        this.props = props;
    }

    /** Load application.properties from classpath. */
    public static AppConfig load() {
        return load("application.properties");
    }

    public static AppConfig load(String resource) {
        Properties props = new Properties();
        try (InputStream is = AppConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (is != null) props.load(is);
            else throw new IllegalStateException(resource + " not found on classpath");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load " + resource, e);
        }
        return new AppConfig(props);
    }

    public static AppConfig of(Properties props) {
        Properties copy = new Properties();
        copy.putAll(Objects.requireNonNull(props, "props"));
        return new AppConfig(copy);
    }

    // ---------------- StreamsConfig (broker-agnostic) ----------------

    @Override
    public int streamBufferCapacity() {
        return Integer.parseInt(get("stream.buffer.capacity", "1024"));
    }

    @Override
    public int streamResumeThreshold() {
        return Integer.parseInt(get("stream.resume.threshold", String.valueOf(streamBufferCapacity() / 2)));
    }

    @Override
    public int pollMs() {
        return Integer.parseInt(get("worker.poll.ms", "100"));
    }

    @Override
    public ThreadFactory threadFactory() {
        return Executors.defaultThreadFactory();
    }

    @Override
    public String clientId() {
        return get("kafka.client.id", "frolyk");
    }

    // ---------------- Kafka-specific ----------------

    public String topic() {
        return get("kafka.topic", "test-topic");
    }

    /** Partitions of {@link #topic()} the demo processes. */
    public List<Integer> partitions() {
        return Arrays.stream(get("kafka.partitions", "0").split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(Integer::valueOf)
                .toList();
    }

    /** Group id for Kafka consumer. */
    public String groupId() {
        return get("kafka.group.id", "frolyk-group");
    }

    /** Bootstrap servers for Kafka cluster. */
    public String bootstrapServers() {
        return get("kafka.bootstrap.servers", "localhost:9092");
    }

    /** Read from the earliest offset when the group has no committed position. */
    public boolean fromBeginning() {
        return Boolean.parseBoolean(get("kafka.from.beginning", "false"));
    }

    /** Properties ready for a byte-array KafkaConsumer with manual commits. */
    public Properties kafkaProperties() {
        Properties out = new Properties();
        props.stringPropertyNames().stream()
                .filter(k -> !k.startsWith("kafka.") && !k.startsWith("stream.") && !k.startsWith("worker."))
                .forEach(k -> out.put(k, props.getProperty(k)));
        out.put("bootstrap.servers", bootstrapServers());
        out.put("group.id", groupId());
        out.put("client.id", clientId());
        out.putIfAbsent("key.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        out.putIfAbsent("value.deserializer", "org.apache.kafka.common.serialization.ByteArrayDeserializer");
        out.putIfAbsent("auto.offset.reset", fromBeginning() ? "earliest" : "latest");
        out.put("enable.auto.commit", "false");
        return out;
    }

    // ---------------- Helpers ----------------

    private String get(String key, String def) {
        return Objects.toString(props.getProperty(key), def);
    }
}
