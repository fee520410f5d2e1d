// file: server/src/main/java/io/fanlite/server/dto/IndexUpsertRequest.java
package io.fanlite.server.dto;

/**
 * JSON body for PUT /admin/index/{db}/{index}.
 * Example:
 *   {
 *     "fingerprint": 4242,
 *     "version": 3,
 *     "numDocs": 1000,
 *     "backfillCompletePercent": 40.0,
 *     "state": "backfill_in_progress"
 *   }
 * Missing fields default to a ready, empty index at version 0.
 */
public class IndexUpsertRequest {
    public Long fingerprint;
    public Integer version;
    public Long numDocs;
    public Float backfillCompletePercent;
    public String state; // ready | backfill_in_progress | backfill_paused_by_oom
}
