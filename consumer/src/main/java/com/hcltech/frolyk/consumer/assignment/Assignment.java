package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.consumer.abstraction.PartitionKey;

import java.util.Objects;

/** One partition, processed and committed on behalf of one consumer group. */
public record Assignment(String topic, int partition, String group) {
    public Assignment {
        Objects.requireNonNull(topic, "topic");
        Objects.requireNonNull(group, "group");
        if (partition < 0) throw new IllegalArgumentException("partition must be >= 0, was " + partition);
    }

    public PartitionKey partitionKey() {
        return new PartitionKey(topic, partition);
    }
}
