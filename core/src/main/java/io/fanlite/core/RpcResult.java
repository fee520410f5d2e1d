// file: core/src/main/java/io/fanlite/core/RpcResult.java
package io.fanlite.core;

import java.util.Objects;

/**
 * (status, response) pair returned by a synchronous call.
 * {@code response} is null unless the status is OK.
 */
public record RpcResult<Res>(RpcStatus status, Res response) {

    public RpcResult {
        Objects.requireNonNull(status, "status");
        if (status.isOk() && response == null) {
            throw new IllegalArgumentException("OK result requires a response");
        }
    }

    public static <Res> RpcResult<Res> ok(Res response) {
        return new RpcResult<>(RpcStatus.ok(), response);
    }

    public static <Res> RpcResult<Res> failed(RpcStatus status) {
        if (status.isOk()) {
            throw new IllegalArgumentException("failed() needs a non-OK status");
        }
        return new RpcResult<>(status, null);
    }
}
