package com.libragraph.model.primitives;

/**
 * Thrown when a {@link Hash} is constructed from a buffer that is not exactly
 * {@link Hash#LENGTH} bytes long.
 */
public class InvalidHashLengthException extends IllegalArgumentException {

    private final int expectedLength;
    private final int actualLength;

    public InvalidHashLengthException(int expectedLength, int actualLength) {
        super("Hash must be " + expectedLength + " bytes (SHA3-256), got: " + actualLength);
        this.expectedLength = expectedLength;
        this.actualLength = actualLength;
    }

    public int expectedLength() {
        return expectedLength;
    }

    public int actualLength() {
        return actualLength;
    }
}
