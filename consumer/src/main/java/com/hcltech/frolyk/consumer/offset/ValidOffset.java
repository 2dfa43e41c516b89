package com.hcltech.frolyk.consumer.offset;

import java.math.BigInteger;
import java.util.Objects;
import java.util.Optional;

/** A parsed, non-negative offset and the metadata to commit with it. */
public record ValidOffset(BigInteger offset, Optional<String> metadata) {
    public ValidOffset {
        Objects.requireNonNull(offset, "offset");
        Objects.requireNonNull(metadata, "metadata");
        if (offset.signum() < 0) throw new InvalidOffsetException(OffsetValidator.REQUIRED + ", was " + offset);
    }
}
