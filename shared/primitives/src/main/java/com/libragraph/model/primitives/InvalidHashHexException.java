package com.libragraph.model.primitives;

/**
 * Thrown when a string is not the hex form of a {@link Hash}: non-hex
 * characters, odd length, or a decoded length other than 32 bytes.
 */
public class InvalidHashHexException extends IllegalArgumentException {

    public InvalidHashHexException(String message) {
        super(message);
    }

    public InvalidHashHexException(String message, Throwable cause) {
        super(message, cause);
    }
}
