// file: server/src/main/java/io/fanlite/server/cluster/GrpcCoordinatorClient.java
package io.fanlite.server.cluster;

import io.fanlite.core.RpcCallback;
import io.fanlite.core.RpcStatus;
import io.fanlite.server.coordinator.CoordinatorGrpc;
import io.fanlite.server.coordinator.CoordinatorProto;
import io.grpc.ManagedChannel;
import io.grpc.ManagedChannelBuilder;
import io.grpc.Status;
import io.grpc.stub.StreamObserver;

import java.util.concurrent.TimeUnit;

/**
 * gRPC-based CoordinatorClient.
 *
 * One instance represents a single remote node (host:port). The deadline is
 * set per call, so the transport gives up on its own; the fanout dispatcher
 * still times the target out independently.
 */
public final class GrpcCoordinatorClient implements CoordinatorClient {

    private final String target; // "host:port" or in-process name
    private final ManagedChannel channel;
    private final CoordinatorGrpc.CoordinatorStub stub;

    /**
     * Production constructor using host and port.
     */
    public GrpcCoordinatorClient(String host, int port) {
        this(
                host + ":" + port,
                ManagedChannelBuilder
                        .forAddress(host, port)
                        .usePlaintext() // internal traffic; terminate TLS at edge if needed
                        .build()
        );
    }

    /**
     * Test-only constructor allowing a pre-built channel (e.g., in-process).
     */
    public GrpcCoordinatorClient(String target, ManagedChannel channel) {
        this.target = target;
        this.channel = channel;
        this.stub = CoordinatorGrpc.newStub(channel);
    }

    @Override
    public void infoIndexPartition(
            CoordinatorProto.InfoIndexPartitionRequest request,
            long timeoutMs,
            RpcCallback<CoordinatorProto.InfoIndexPartitionResponse> callback
    ) {
        stub.withDeadlineAfter(timeoutMs, TimeUnit.MILLISECONDS)
                .infoIndexPartition(request, new SingleResponseObserver<>(target, callback));
    }

    /**
     * Translate a gRPC status into the transport-neutral status the fanout
     * engine understands.
     */
    static RpcStatus toRpcStatus(Status status, String target) {
        String detail = target + ": " + (status.getDescription() == null
                ? status.getCode().name()
                : status.getDescription());
        return switch (status.getCode()) {
            case OK -> RpcStatus.ok();
            case DEADLINE_EXCEEDED -> RpcStatus.timeout(detail);
            case UNAVAILABLE -> RpcStatus.unavailable(detail);
            default -> RpcStatus.remoteError(status.getCode().value(), detail);
        };
    }

    @Override
    public void close() {
        channel.shutdown();
        try {
            channel.awaitTermination(5, TimeUnit.SECONDS);
        } catch (InterruptedException ignored) {
            Thread.currentThread().interrupt();
        }
    }

    @Override
    public String toString() {
        return "GrpcCoordinatorClient[" + target + "]";
    }

    /** Unary-call observer that reports to the callback once. */
    private static final class SingleResponseObserver<T> implements StreamObserver<T> {
        private final String target;
        private final RpcCallback<T> callback;
        private T response;

        SingleResponseObserver(String target, RpcCallback<T> callback) {
            this.target = target;
            this.callback = callback;
        }

        @Override
        public void onNext(T value) {
            response = value;
        }

        @Override
        public void onError(Throwable t) {
            callback.onComplete(toRpcStatus(Status.fromThrowable(t), target), null);
        }

        @Override
        public void onCompleted() {
            if (response == null) {
                callback.onComplete(RpcStatus.internal(target + ": call completed without a response"), null);
            } else {
                callback.onComplete(RpcStatus.ok(), response);
            }
        }
    }
}
