package com.hcltech.frolyk.consumer.abstraction;

import java.util.concurrent.ThreadFactory;

/**
 * Broker-agnostic configuration of the streaming layer.
 */
public interface StreamsConfig {

    /** Messages buffered per partition before the partition is paused. */
    int streamBufferCapacity();

    /** Buffered count at or below which a paused partition is resumed. */
    int streamResumeThreshold();

    /** Poll timeout in ms of the delivery loop. */
    int pollMs();

    /** Thread factory for the delivery loop. */
    ThreadFactory threadFactory();

    /** Client id (for thread names and logging). */
    String clientId();

    static StreamsConfig defaults() {
        return new StreamsConfig() {
            @Override public int streamBufferCapacity() { return 1024; }
            @Override public int streamResumeThreshold() { return 512; }
            @Override public int pollMs() { return 100; }
            @Override public ThreadFactory threadFactory() { return java.util.concurrent.Executors.defaultThreadFactory(); }
            @Override public String clientId() { return "frolyk"; }
        };
    }
}
