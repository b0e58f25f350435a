package com.libragraph.model.primitives;

/**
 * Wraps a failure of the underlying digest primitive.
 * Indicates an environment fault (missing provider, misconfiguration), never bad input.
 */
public class DigestComputationException extends RuntimeException {

    public DigestComputationException(String message, Throwable cause) {
        super(message, cause);
    }

    public DigestComputationException(String message) {
        super(message);
    }
}
