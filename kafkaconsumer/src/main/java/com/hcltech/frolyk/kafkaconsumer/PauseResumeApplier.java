package com.hcltech.frolyk.kafkaconsumer;

import org.apache.kafka.clients.consumer.Consumer;
import org.apache.kafka.common.TopicPartition;

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Records which partitions should be paused, from any thread, and applies the delta to the consumer
 * on the poll thread. Requests for partitions not currently assigned wait until they are.
 */
final class PauseResumeApplier {
    private final Set<TopicPartition> requested = ConcurrentHashMap.newKeySet();

    void requestPause(TopicPartition tp) {
        requested.add(tp);
    }

    void requestResume(TopicPartition tp) {
        requested.remove(tp);
    }

    Set<TopicPartition> requested() {
        return Collections.unmodifiableSet(requested);
    }

    /** Poll thread only. */
    void apply(Consumer<?, ?> consumer) {
        Set<TopicPartition> assigned = consumer.assignment();
        if (assigned == null || assigned.isEmpty()) return;
        Set<TopicPartition> paused = consumer.paused();

        Set<TopicPartition> toPause = null;
        Set<TopicPartition> toResume = null;

        for (TopicPartition tp : assigned) {
            boolean wanted = requested.contains(tp);
            if (wanted && !paused.contains(tp)) {
                if (toPause == null) toPause = new HashSet<>();
                toPause.add(tp);
            } else if (!wanted && paused.contains(tp)) {
                if (toResume == null) toResume = new HashSet<>();
                toResume.add(tp);
            }
        }

        if (toPause != null) consumer.pause(toPause);
        if (toResume != null) consumer.resume(toResume);
    }

    void clear() {
        requested.clear();
    }
}
