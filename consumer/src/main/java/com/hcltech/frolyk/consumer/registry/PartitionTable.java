package com.hcltech.frolyk.consumer.registry;

import com.hcltech.frolyk.consumer.abstraction.PartitionKey;

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;

/** Routing table from partition to its entry. Entries are created once and never replaced. */
final class PartitionTable<V> {
    private final Map<PartitionKey, V> entries = new ConcurrentHashMap<>();
    private final Function<PartitionKey, V> factory;

    PartitionTable(Function<PartitionKey, V> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    V getOrCreate(PartitionKey key) {
        Objects.requireNonNull(key, "key");
        return entries.computeIfAbsent(key, factory);
    }

    Set<PartitionKey> keys() {
        return Collections.unmodifiableSet(entries.keySet());
    }

    Collection<V> values() {
        return Collections.unmodifiableCollection(entries.values());
    }
}
