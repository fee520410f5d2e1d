// file: server/src/main/java/io/fanlite/server/cluster/ClusterView.java
package io.fanlite.server.cluster;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Current topology, swappable at runtime. Readers take a consistent snapshot
 * per call; a swap becomes visible to the next fanout round.
 */
public final class ClusterView {

    private static final Logger log = Logger.getLogger(ClusterView.class.getName());

    private final AtomicReference<ClusterConfig> current;
    private final List<Consumer<ClusterConfig>> listeners = new CopyOnWriteArrayList<>();

    public ClusterView(ClusterConfig initial) {
        this.current = new AtomicReference<>(Objects.requireNonNull(initial, "initial"));
    }

    public ClusterConfig current() {
        return current.get();
    }

    /** Called with the new topology after every successful update. */
    public void addListener(Consumer<ClusterConfig> listener) {
        listeners.add(Objects.requireNonNull(listener, "listener"));
    }

    /**
     * Replace the topology. The local node identity must not change.
     */
    public void update(ClusterConfig next) {
        Objects.requireNonNull(next, "next");
        ClusterConfig prev = current.get();
        if (!prev.localNodeId().equals(next.localNodeId())) {
            throw new IllegalArgumentException(
                    "localNodeId cannot change from %s to %s".formatted(prev.localNodeId(), next.localNodeId()));
        }
        current.set(next);
        log.log(Level.INFO, "topology updated: {0} shards, {1} nodes",
                new Object[]{next.shards().size(), next.nodes().size()});

        for (Consumer<ClusterConfig> l : listeners) {
            try {
                l.accept(next);
            } catch (RuntimeException e) {
                log.log(Level.WARNING, "topology listener " + l + " failed", e);
            }
        }
    }
}
