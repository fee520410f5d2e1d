// file: server/src/main/java/io/fanlite/server/index/IndexDescriptor.java
package io.fanlite.server.index;

import java.util.Objects;

/**
 * This node's view of one index partition.
 *
 * @param dbNum                   logical database the index lives in
 * @param name                    index name, unique per database
 * @param fingerprint             hash of the index definition
 * @param version                 bumped each time the definition changes
 * @param numDocs                 documents indexed on this node
 * @param backfillCompletePercent backfill progress in [0, 100]
 * @param state                   lifecycle state
 */
public record IndexDescriptor(
        int dbNum,
        String name,
        long fingerprint,
        int version,
        long numDocs,
        float backfillCompletePercent,
        IndexState state
) {
    public IndexDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(state, "state");
        if (name.isBlank()) throw new IllegalArgumentException("index name must not be blank");
        if (dbNum < 0) throw new IllegalArgumentException("dbNum must be >= 0");
        if (version < 0) throw new IllegalArgumentException("version must be >= 0");
        if (numDocs < 0) throw new IllegalArgumentException("numDocs must be >= 0");
        if (backfillCompletePercent < 0f || backfillCompletePercent > 100f) {
            throw new IllegalArgumentException("backfillCompletePercent must be in [0, 100]");
        }
    }

    public boolean backfillInProgress() {
        return state != IndexState.READY;
    }
}
