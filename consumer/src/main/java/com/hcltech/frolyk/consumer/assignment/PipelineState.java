package com.hcltech.frolyk.consumer.assignment;

/** Lifecycle of an assignment pipeline. */
public enum PipelineState {
    /** Processor factories are being initialised. */
    CONSTRUCTING,
    /** All factories resolved; the output stream may be drawn. */
    READY,
    /** The output stream ended. Only reachable for bounded feeds. */
    COMPLETED,
    /** A factory, a processor or the feed failed. */
    FAILED
}
