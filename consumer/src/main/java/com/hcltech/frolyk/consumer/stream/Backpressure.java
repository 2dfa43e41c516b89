package com.hcltech.frolyk.consumer.stream;

/**
 * Flow-control hooks of a {@link BufferedMessageStream}.
 * Called with the stream's lock held, so implementations must only hand the request off.
 */
public interface Backpressure {

    Backpressure NONE = new Backpressure() {
        @Override public void pause() {}
        @Override public void resume() {}
    };

    /** The buffer reached capacity. */
    void pause();

    /** A paused buffer drained to the resume threshold. */
    void resume();
}
