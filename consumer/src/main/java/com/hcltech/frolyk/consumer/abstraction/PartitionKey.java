package com.hcltech.frolyk.consumer.abstraction;

import java.util.Objects;

/** Identity of one partition of one topic. Equal iff topic and partition are equal. */
public record PartitionKey(String topic, int partition) {
    public PartitionKey {
        Objects.requireNonNull(topic, "topic");
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0, was " + partition);
    }

    @Override
    public String toString() {
        return topic + "-" + partition;
    }
}
