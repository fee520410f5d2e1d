// file: server/src/main/java/io/fanlite/server/dto/ClusterInfoResponse.java
package io.fanlite.server.dto;

import java.util.List;

/**
 * JSON body returned by GET /ft/info/{db}/{index}.
 */
public class ClusterInfoResponse {
    public String indexName;
    public int dbNum;
    public boolean exists;
    public String state;
    public long numDocs;
    public boolean backfillInProgress;
    public float backfillCompletePercentMin;
    public float backfillCompletePercentMax;
    public long fingerprint;
    public int version;
    public boolean consistent;
    public boolean incomplete;  // some node failed or nodes still disagreed at the last round
    public List<String> respondedNodes;
    public List<String> failedNodes;
    public int rounds;
}
