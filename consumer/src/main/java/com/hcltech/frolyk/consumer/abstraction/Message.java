package com.hcltech.frolyk.consumer.abstraction;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A record delivered by the underlying consumer.
 * Key and value are raw bytes and may be null. The arrays are never modified after delivery.
 * Equality compares key, value and header bytes by content.
 */
public record Message(String topic,
                      int partition,
                      BigInteger offset,
                      byte[] key,
                      byte[] value,
                      long timestamp,
                      Map<String, byte[]> headers) {

    public Message {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(offset, "offset");
        headers = headers == null || headers.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(headers));
    }

    public Message(String topic, int partition, long offset, byte[] key, byte[] value) {
        this(topic, partition, BigInteger.valueOf(offset), key, value, -1L, Map.of());
    }

    public PartitionKey partitionKey() {
        return new PartitionKey(topic, partition);
    }

    public String keyAsString() {
        return key == null ? null : new String(key, StandardCharsets.UTF_8);
    }

    public String valueAsString() {
        return value == null ? null : new String(value, StandardCharsets.UTF_8);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Message other)) return false;
        return partition == other.partition
                && timestamp == other.timestamp
                && topic.equals(other.topic)
                && offset.equals(other.offset)
                && Arrays.equals(key, other.key)
                && Arrays.equals(value, other.value)
                && sameHeaders(headers, other.headers);
    }

    @Override
    public int hashCode() {
        int h = Objects.hash(topic, partition, offset, timestamp);
        h = 31 * h + Arrays.hashCode(key);
        h = 31 * h + Arrays.hashCode(value);
        for (Map.Entry<String, byte[]> e : headers.entrySet()) {
            h += e.getKey().hashCode() ^ Arrays.hashCode(e.getValue());
        }
        return h;
    }

    private static boolean sameHeaders(Map<String, byte[]> a, Map<String, byte[]> b) {
        if (a.size() != b.size()) return false;
        for (Map.Entry<String, byte[]> e : a.entrySet()) {
            if (!b.containsKey(e.getKey()) || !Arrays.equals(e.getValue(), b.get(e.getKey()))) return false;
        }
        return true;
    }

    @Override
    public String toString() {
        return "Message(" + topic + "-" + partition + "@" + offset + ")";
    }
}
