// file: server/src/main/java/io/fanlite/server/cluster/CoordinatorClientPool.java
package io.fanlite.server.cluster;

import io.fanlite.core.ClientPool;
import io.fanlite.core.NodeInfo;

import java.util.Collection;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Lazily created CoordinatorClients, one per remote address.
 */
public final class CoordinatorClientPool implements ClientPool<CoordinatorClient>, AutoCloseable {

    private static final Logger log = Logger.getLogger(CoordinatorClientPool.class.getName());

    private final Function<NodeInfo, CoordinatorClient> factory;
    private final ConcurrentMap<String, CoordinatorClient> clients = new ConcurrentHashMap<>();
    private volatile boolean closed;

    /** Pool of plaintext gRPC clients. */
    public CoordinatorClientPool() {
        this(node -> new GrpcCoordinatorClient(node.host(), node.port()));
    }

    public CoordinatorClientPool(Function<NodeInfo, CoordinatorClient> factory) {
        this.factory = Objects.requireNonNull(factory, "factory");
    }

    @Override
    public CoordinatorClient clientFor(NodeInfo node) {
        if (closed) {
            throw new IllegalStateException("client pool is closed");
        }
        return clients.computeIfAbsent(node.address(), addr -> {
            log.log(Level.FINE, "opening coordinator client to {0} ({1})", new Object[]{node.nodeId(), addr});
            return factory.apply(node);
        });
    }

    /**
     * Close clients whose address is no longer part of the topology.
     */
    public void retainOnly(Collection<NodeInfo> nodes) {
        Set<String> keep = nodes.stream().map(NodeInfo::address).collect(Collectors.toSet());
        clients.keySet().removeIf(addr -> {
            if (keep.contains(addr)) {
                return false;
            }
            CoordinatorClient c = clients.get(addr);
            if (c != null) {
                closeQuietly(addr, c);
            }
            return true;
        });
    }

    public int size() {
        return clients.size();
    }

    @Override
    public void close() {
        closed = true;
        clients.forEach(this::closeQuietly);
        clients.clear();
    }

    private void closeQuietly(String addr, CoordinatorClient client) {
        try {
            client.close();
        } catch (RuntimeException e) {
            log.log(Level.WARNING, "closing coordinator client to " + addr + " failed", e);
        }
    }
}
