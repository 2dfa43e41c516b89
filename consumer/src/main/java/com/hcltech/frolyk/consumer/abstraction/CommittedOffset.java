package com.hcltech.frolyk.consumer.abstraction;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/** A committed position as reported back by the client. */
public record CommittedOffset(BigInteger offset, Optional<String> metadata) {
    public CommittedOffset {
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(metadata, "metadata");
    }
}
