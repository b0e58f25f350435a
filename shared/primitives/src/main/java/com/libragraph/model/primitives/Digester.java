package com.libragraph.model.primitives;

/**
 * Digest primitive consumed by {@link Hash#digest(byte[], Digester)}.
 *
 * Implementations must be stateless or thread-safe and return exactly
 * {@link Hash#LENGTH} bytes for any input.
 */
@FunctionalInterface
public interface Digester {

    /**
     * Computes the digest of {@code data}. Must not modify {@code data}.
     */
    byte[] digest(byte[] data);

    /**
     * The default SHA3-256 primitive.
     */
    static Digester sha3() {
        return Sha3Digester.INSTANCE;
    }
}
