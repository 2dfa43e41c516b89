package com.hcltech.frolyk.kafkaconsumer;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

class AppConfigTest {

    @Test
    void loadsFromClasspathResource() {
        AppConfig config = AppConfig.load("test-application.properties");
        assertEquals("orders", config.topic());
        assertEquals(List.of(0, 1, 2), config.partitions());
        assertEquals("billing", config.groupId());
        assertEquals("test-client", config.clientId());
        assertEquals(8, config.streamBufferCapacity());
        assertEquals(2, config.streamResumeThreshold());
        assertEquals(25, config.pollMs());
    }

    @Test
    void missingResourceFails() {
        assertThrows(IllegalStateException.class, () -> AppConfig.load("no-such.properties"));
    }

    @Test
    void defaultsApplyWhenKeysAreAbsent() {
        AppConfig config = AppConfig.of(new Properties());
        assertEquals(1024, config.streamBufferCapacity());
        assertEquals(512, config.streamResumeThreshold());
        assertEquals(100, config.pollMs());
        assertEquals("frolyk", config.clientId());
        assertEquals(List.of(0), config.partitions());
        assertFalse(config.fromBeginning());
    }

    @Test
    void kafkaPropertiesUseByteArraysAndManualCommits() {
        Properties props = new Properties();
        props.setProperty("kafka.bootstrap.servers", "broker:9092");
        props.setProperty("kafka.group.id", "billing");
        props.setProperty("kafka.from.beginning", "true");
        props.setProperty("enable.auto.commit", "true");
        props.setProperty("max.poll.records", "50");
        props.setProperty("stream.buffer.capacity", "10");

        Properties kafka = AppConfig.of(props).kafkaProperties();

        assertEquals("broker:9092", kafka.get("bootstrap.servers"));
        assertEquals("billing", kafka.get("group.id"));
        assertEquals("earliest", kafka.get("auto.offset.reset"));
        assertEquals("false", kafka.get("enable.auto.commit"));
        assertEquals("50", kafka.get("max.poll.records"));
        assertEquals("org.apache.kafka.common.serialization.ByteArrayDeserializer", kafka.get("value.deserializer"));
        assertFalse(kafka.containsKey("stream.buffer.capacity"));
    }
}
