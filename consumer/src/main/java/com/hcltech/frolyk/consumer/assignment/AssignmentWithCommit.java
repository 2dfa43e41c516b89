package com.hcltech.frolyk.consumer.assignment;

import com.hcltech.frolyk.consumer.abstraction.CommitRequest;
import com.hcltech.frolyk.consumer.abstraction.CommittedOffset;
import com.hcltech.frolyk.consumer.abstraction.ConsumerClient;
import com.hcltech.frolyk.consumer.offset.InvalidOffsetException;
import com.hcltech.frolyk.consumer.offset.OffsetValidator;
import com.hcltech.frolyk.consumer.offset.ValidOffset;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * An {@link Assignment} together with the ability to commit offsets for it.
 * Commits always target the assignment's own group, topic and partition.
 */
public final class AssignmentWithCommit {
    private static final Logger log = LoggerFactory.getLogger(AssignmentWithCommit.class);

    private final Assignment assignment;
    private final ConsumerClient client;

    AssignmentWithCommit(Assignment assignment, ConsumerClient client) {
        this.assignment = Objects.requireNonNull(assignment, "assignment");
        this.client = Objects.requireNonNull(client, "client");
    }

    public Assignment assignment() { return assignment; }

    public String topic() { return assignment.topic(); }

    public int partition() { return assignment.partition(); }

    public String group() { return assignment.group(); }

    /** {@link #commitOffset(Object, String)} without metadata. */
    public CompletableFuture<Void> commitOffset(Object offset) {
        return commitOffset(offset, null);
    }

    /**
     * Commits {@code offset} as the next offset to read, that is the last consumed offset plus one.
     * The offset is validated before the client is contacted; an invalid one fails the returned
     * future with {@link InvalidOffsetException} and nothing is committed.
     *
     * @param offset   a decimal string, an integral number or a {@link java.math.BigInteger}
     * @param metadata stored alongside the offset; null for none
     */
    public CompletableFuture<Void> commitOffset(Object offset, String metadata) {
        ValidOffset valid;
        try {
            valid = OffsetValidator.validOffset(offset, metadata);
        } catch (InvalidOffsetException e) {
            log.warn("Rejected commit for {} group {}: {}", assignment.partitionKey(), assignment.group(), e.getMessage());
            return CompletableFuture.failedFuture(e);
        }
        CommitRequest request = new CommitRequest(assignment.group(), assignment.partitionKey(), valid.offset(), valid.metadata());
        log.debug("Committing {} for {} group {}", valid.offset(), assignment.partitionKey(), assignment.group());
        try {
            return client.commitOffsets(List.of(request));
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    /** The offset currently committed for this assignment, if any. */
    public CompletableFuture<Optional<CommittedOffset>> committedOffset() {
        try {
            return client.committed(assignment.group(), assignment.partitionKey());
        } catch (RuntimeException e) {
            return CompletableFuture.failedFuture(e);
        }
    }

    @Override
    public String toString() {
        return "AssignmentWithCommit(" + assignment + ")";
    }
}
