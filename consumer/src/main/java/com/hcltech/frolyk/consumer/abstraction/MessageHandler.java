package com.hcltech.frolyk.consumer.abstraction;

/** Receives every message of the shared feed, on the client's delivery thread. */
@FunctionalInterface
public interface MessageHandler {
    void onMessage(Message message) throws Exception;
}
