package com.hcltech.frolyk.consumer.abstraction;

import org.junit.jupiter.api.Test;

import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class MessageTest {

    @Test
    void partitionKeyHasValueEquality() {
        assertEquals(new PartitionKey("orders", 1), new PartitionKey("orders", 1));
        assertNotEquals(new PartitionKey("orders", 1), new PartitionKey("orders", 2));
        assertEquals("orders-1", new PartitionKey("orders", 1).toString());
        assertThrows(IllegalArgumentException.class, () -> new PartitionKey("orders", -1));
        assertThrows(NullPointerException.class, () -> new PartitionKey(null, 0));
    }

    @Test
    void headersAreCopiedAndReadOnly() {
        Map<String, byte[]> headers = new LinkedHashMap<>();
        headers.put("h", new byte[]{1});
        Message m = new Message("orders", 0, BigInteger.TWO, null, null, 10L, headers);
        headers.put("later", new byte[]{2});

        assertEquals(1, m.headers().size());
        assertThrows(UnsupportedOperationException.class, () -> m.headers().put("x", new byte[0]));
        assertEquals(new PartitionKey("orders", 0), m.partitionKey());
    }

    @Test
    void decodesKeyAndValueAsUtf8() {
        Message m = new Message("orders", 0, 5L, "k".getBytes(StandardCharsets.UTF_8), "vålue".getBytes(StandardCharsets.UTF_8));
        assertEquals("k", m.keyAsString());
        assertEquals("vålue", m.valueAsString());
        assertEquals(BigInteger.valueOf(5), m.offset());
    }

    @Test
    void equalityComparesBytesByContent() {
        Message a = new Message("orders", 0, BigInteger.ONE, "k".getBytes(StandardCharsets.UTF_8),
                "v".getBytes(StandardCharsets.UTF_8), 10L, Map.of("h", new byte[]{1, 2}));
        Message b = new Message("orders", 0, BigInteger.ONE, "k".getBytes(StandardCharsets.UTF_8),
                "v".getBytes(StandardCharsets.UTF_8), 10L, Map.of("h", new byte[]{1, 2}));
        assertEquals(a, b);
        assertEquals(a.hashCode(), b.hashCode());

        assertNotEquals(a, new Message("orders", 0, BigInteger.ONE, "k".getBytes(StandardCharsets.UTF_8),
                "w".getBytes(StandardCharsets.UTF_8), 10L, Map.of("h", new byte[]{1, 2})));
        assertNotEquals(a, new Message("orders", 0, BigInteger.ONE, "k".getBytes(StandardCharsets.UTF_8),
                "v".getBytes(StandardCharsets.UTF_8), 10L, Map.of("h", new byte[]{3})));
        assertEquals(new Message("orders", 0, 1L, null, null), new Message("orders", 0, 1L, null, null));
    }

    @Test
    void commitRequestRejectsNegativeOffsets() {
        PartitionKey key = new PartitionKey("orders", 0);
        assertThrows(IllegalArgumentException.class,
                () -> new CommitRequest("g", key, BigInteger.valueOf(-1), Optional.empty()));
        assertEquals(Optional.of(""), new CommitRequest("g", key, BigInteger.ZERO, Optional.of("")).metadata());
    }
}
