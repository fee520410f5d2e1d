// file: server/src/main/java/io/fanlite/server/index/IndexInfoProvider.java
package io.fanlite.server.index;

import io.fanlite.server.coordinator.CoordinatorProto;

import java.util.Objects;
import java.util.Optional;

/**
 * Builds this node's answer to an InfoIndexPartition request.
 * <br>
 * Both the gRPC service and the fanout operation's local path call
 * {@link #describe}, so a node answers itself exactly as it answers peers.
 */
public final class IndexInfoProvider {

    private final IndexRegistry registry;

    public IndexInfoProvider(IndexRegistry registry) {
        this.registry = Objects.requireNonNull(registry, "registry");
    }

    public CoordinatorProto.InfoIndexPartitionResponse describe(CoordinatorProto.InfoIndexPartitionRequest request) {
        String name = request.getIndexName();
        if (name.isBlank()) {
            throw new IllegalArgumentException("index name must not be blank");
        }
        int dbNum = request.getDbNum();

        var builder = CoordinatorProto.InfoIndexPartitionResponse.newBuilder()
                .setIndexName(name)
                .setDbNum(dbNum);

        Optional<IndexDescriptor> found = registry.find(dbNum, name);
        if (found.isEmpty()) {
            return builder.setExists(false).build();
        }

        IndexDescriptor d = found.get();
        return builder
                .setExists(true)
                .setNumDocs(d.numDocs())
                .setBackfillInProgress(d.backfillInProgress())
                .setBackfillCompletePercent(d.backfillCompletePercent())
                .setState(d.state().wireName())
                .setIndexFingerprintVersion(
                        CoordinatorProto.IndexFingerprintVersion.newBuilder()
                                .setFingerprint(d.fingerprint())
                                .setVersion(d.version())
                                .build()
                )
                .build();
    }

    public IndexRegistry registry() {
        return registry;
    }
}
