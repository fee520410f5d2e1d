// file: server/src/main/java/io/fanlite/server/coordinator/GrpcCoordinatorService.java
package io.fanlite.server.coordinator;

import io.fanlite.server.index.IndexInfoProvider;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.Objects;

/**
 * gRPC service that exposes this node's index catalogue to peers running a
 * fanout.
 *
 * This is the node-to-node API (internal), not the external HTTP API.
 *
 * Responsibilities:
 *  - Answer InfoIndexPartition through the same IndexInfoProvider the local
 *    fanout path uses.
 *  - Map IllegalArgumentException to INVALID_ARGUMENT, everything else to INTERNAL.
 */
public final class GrpcCoordinatorService extends CoordinatorGrpc.CoordinatorImplBase {

    private final IndexInfoProvider info;

    public GrpcCoordinatorService(IndexInfoProvider info) {
        this.info = Objects.requireNonNull(info, "info");
    }

    @Override
    public void infoIndexPartition(
            CoordinatorProto.InfoIndexPartitionRequest request,
            StreamObserver<CoordinatorProto.InfoIndexPartitionResponse> responseObserver
    ) {
        try {
            responseObserver.onNext(info.describe(request));
            responseObserver.onCompleted();
        } catch (IllegalArgumentException iae) {
            responseObserver.onError(
                    Status.INVALID_ARGUMENT
                            .withDescription(iae.getMessage())
                            .asException()
            );
        } catch (Exception e) {
            responseObserver.onError(
                    Status.INTERNAL
                            .withDescription(e.getMessage())
                            .asException()
            );
        }
    }
}
