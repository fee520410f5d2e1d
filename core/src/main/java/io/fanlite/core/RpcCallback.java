// file: core/src/main/java/io/fanlite/core/RpcCallback.java
package io.fanlite.core;

/**
 * Completion hook for an asynchronous call. Called once per call:
 * with an OK status and a response, or with a failure status and null.
 */
@FunctionalInterface
public interface RpcCallback<Res> {

    void onComplete(RpcStatus status, Res response);
}
