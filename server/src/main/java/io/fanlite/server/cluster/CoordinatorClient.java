// file: server/src/main/java/io/fanlite/server/cluster/CoordinatorClient.java
package io.fanlite.server.cluster;

import io.fanlite.core.RpcCallback;
import io.fanlite.core.RpcResult;
import io.fanlite.core.RpcStatus;
import io.fanlite.server.coordinator.CoordinatorProto;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Internal client for the node-to-node Coordinator API of one remote node.
 * <br>
 * Calls are asynchronous: the callback fires once with either OK and a
 * response, or a failure status (remote error, timeout, unavailable).
 */
public interface CoordinatorClient extends AutoCloseable {

    /**
     * Describe the remote node's partition of an index.
     *
     * @param timeoutMs deadline for this call
     */
    void infoIndexPartition(
            CoordinatorProto.InfoIndexPartitionRequest request,
            long timeoutMs,
            RpcCallback<CoordinatorProto.InfoIndexPartitionResponse> callback
    );

    /**
     * Blocking form of {@link #infoIndexPartition}, for diagnostics and tests.
     */
    default RpcResult<CoordinatorProto.InfoIndexPartitionResponse> infoIndexPartitionBlocking(
            CoordinatorProto.InfoIndexPartitionRequest request,
            long timeoutMs
    ) {
        CompletableFuture<RpcResult<CoordinatorProto.InfoIndexPartitionResponse>> done = new CompletableFuture<>();
        infoIndexPartition(request, timeoutMs, (status, response) ->
                done.complete(status.isOk() ? RpcResult.ok(response) : RpcResult.failed(status)));
        try {
            return done.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException te) {
            return RpcResult.failed(RpcStatus.timeout("no answer within " + timeoutMs + "ms"));
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
            return RpcResult.failed(RpcStatus.unavailable("interrupted"));
        } catch (ExecutionException ee) {
            return RpcResult.failed(RpcStatus.internal(String.valueOf(ee.getCause())));
        }
    }

    /** Release the underlying connection. */
    @Override
    void close();
}
