// file: server/src/main/java/io/fanlite/server/index/IndexRegistry.java
package io.fanlite.server.index;

import java.util.Comparator;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * In-memory catalogue of the index partitions held by this node.
 * <br>
 * Thread-safe: the HTTP admin surface writes while fanout calls (local and
 * gRPC) read concurrently.
 */
public final class IndexRegistry {

    private record Key(int dbNum, String name) {}

    private final ConcurrentMap<Key, IndexDescriptor> indexes = new ConcurrentHashMap<>();

    /** Create or replace the descriptor for (dbNum, name). */
    public IndexDescriptor upsert(IndexDescriptor descriptor) {
        Objects.requireNonNull(descriptor, "descriptor");
        indexes.put(new Key(descriptor.dbNum(), descriptor.name()), descriptor);
        return descriptor;
    }

    /** @return true if an index was removed */
    public boolean drop(int dbNum, String name) {
        return indexes.remove(new Key(dbNum, name)) != null;
    }

    public Optional<IndexDescriptor> find(int dbNum, String name) {
        return Optional.ofNullable(indexes.get(new Key(dbNum, name)));
    }

    public List<IndexDescriptor> list() {
        return indexes.values().stream()
                .sorted(Comparator.comparingInt(IndexDescriptor::dbNum).thenComparing(IndexDescriptor::name))
                .toList();
    }
}
