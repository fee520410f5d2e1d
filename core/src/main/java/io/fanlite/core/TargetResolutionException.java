// file: core/src/main/java/io/fanlite/core/TargetResolutionException.java
package io.fanlite.core;

/**
 * Raised when the set of nodes for a fanout round cannot be enumerated
 * (unknown or incomplete topology). Fatal for the query: never retried.
 */
public class TargetResolutionException extends Exception {

    public TargetResolutionException(String message) {
        super(message);
    }

    public TargetResolutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
