// file: server/src/main/java/io/fanlite/server/index/IndexState.java
package io.fanlite.server.index;

/**
 * Lifecycle state of an index partition, ordered from healthiest to most
 * degraded. Aggregation across nodes keeps the most severe state seen.
 */
public enum IndexState {
    READY("ready"),
    BACKFILL_IN_PROGRESS("backfill_in_progress"),
    BACKFILL_PAUSED_BY_OOM("backfill_paused_by_oom");

    private final String wireName;

    IndexState(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }

    public static IndexState fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return READY;
        }
        for (IndexState s : values()) {
            if (s.wireName.equalsIgnoreCase(name) || s.name().equalsIgnoreCase(name)) {
                return s;
            }
        }
        throw new IllegalArgumentException("unknown index state: " + name);
    }

    public IndexState mostSevere(IndexState other) {
        return other == null || compareTo(other) >= 0 ? this : other;
    }
}
