package com.hcltech.frolyk.consumer.abstraction;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/**
 * Request to record {@code offset} as the next position to read for {@code group} on one partition.
 * An absent metadata is {@link Optional#empty()}, which is not the same as an empty string.
 */
public record CommitRequest(String group, PartitionKey partitionKey, BigInteger offset, Optional<String> metadata) {
    public CommitRequest {
        Objects.requireNonNull(group, "group");
        Objects.requireNonNull(partitionKey, "partitionKey");
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(metadata, "metadata");
        if (offset.signum() < 0) throw new IllegalArgumentException("offset must be >= 0, was " + offset);
    }
}
