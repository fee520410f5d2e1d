// file: core/src/main/java/io/fanlite/core/RpcStatus.java
package io.fanlite.core;

import java.util.Objects;

/**
 * Outcome of one call to one target.
 *
 * @param code       coarse outcome
 * @param remoteCode transport-specific error code for REMOTE_ERROR, 0 otherwise
 * @param message    human-readable detail, empty for OK
 */
public record RpcStatus(Code code, int remoteCode, String message) {

    public enum Code {
        OK,
        REMOTE_ERROR,
        TIMEOUT,
        UNAVAILABLE
    }

    /** remoteCode used when the failure happened in-process rather than on the wire. */
    public static final int LOCAL_FAILURE = -1;

    private static final RpcStatus OK = new RpcStatus(Code.OK, 0, "");

    public RpcStatus {
        Objects.requireNonNull(code, "code");
        message = message == null ? "" : message;
    }

    public static RpcStatus ok() {
        return OK;
    }

    public static RpcStatus remoteError(int remoteCode, String message) {
        return new RpcStatus(Code.REMOTE_ERROR, remoteCode, message);
    }

    public static RpcStatus internal(String message) {
        return new RpcStatus(Code.REMOTE_ERROR, LOCAL_FAILURE, message);
    }

    public static RpcStatus timeout(String message) {
        return new RpcStatus(Code.TIMEOUT, 0, message);
    }

    public static RpcStatus unavailable(String message) {
        return new RpcStatus(Code.UNAVAILABLE, 0, message);
    }

    public boolean isOk() {
        return code == Code.OK;
    }

    @Override
    public String toString() {
        if (code == Code.REMOTE_ERROR) {
            return "REMOTE_ERROR(" + remoteCode + "): " + message;
        }
        return message.isEmpty() ? code.name() : code.name() + ": " + message;
    }
}
