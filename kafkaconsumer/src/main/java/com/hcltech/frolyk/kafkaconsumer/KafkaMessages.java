package com.hcltech.frolyk.kafkaconsumer;

import com.hcltech.frolyk.consumer.abstraction.Message;
import com.hcltech.frolyk.consumer.abstraction.PartitionKey;
import org.apache.kafka.clients.consumer.ConsumerRecord;
import org.apache.kafka.common.TopicPartition;
import org.apache.kafka.common.header.Header;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.Map;

/** Conversions between Kafka's types and the broker-agnostic ones. */
final class KafkaMessages {

    private KafkaMessages() {
    }

    /** Headers with a repeated key keep the last value. */
    static Message toMessage(ConsumerRecord<byte[], byte[]> r) {
        Map<String, byte[]> headers = new LinkedHashMap<>();
        if (r.headers() != null) {
            for (Header h : r.headers()) headers.put(h.key(), h.value());
        }
        return new Message(r.topic(), r.partition(), BigInteger.valueOf(r.offset()),
                r.key(), r.value(), r.timestamp(), headers);
    }

    static TopicPartition topicPartition(PartitionKey key) {
        return new TopicPartition(key.topic(), key.partition());
    }

    static PartitionKey partitionKey(TopicPartition tp) {
        return new PartitionKey(tp.topic(), tp.partition());
    }
}
