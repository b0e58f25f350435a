package com.libragraph.model.primitives;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import org.jboss.logging.Logger;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * Represents a SHA3-256 content hash (32 bytes).
 * Immutable value object that can be used as a map key or sorted.
 *
 * <p>Instances are created from raw bytes ({@link #fromBytes}), from hex
 * ({@link #parse}) or by hashing data ({@link #digest}). The backing array is
 * copied on the way in and on every {@link #bytes()} call, so no caller ever
 * holds a reference to it.
 *
 * <p>{@link #equals} runs in constant time. It is used to verify content
 * against an expected hash.
 *
 * <p>JSON form is the plain hex string.
 */
public record Hash(byte[] bytes) implements Comparable<Hash> {
    /** Number of bytes in a hash (256 bits). */
    public static final int LENGTH = 32;

    private static final Logger log = Logger.getLogger(Hash.class);
    private static final HexFormat HEX_FORMAT = HexFormat.of();
    private static final int SHORT_PREFIX = 6;
    private static final int MAX_ECHOED_INPUT = 80;

    /** The all-zero hash. */
    public static final Hash EMPTY = new Hash(new byte[LENGTH]);

    public Hash {
        Objects.requireNonNull(bytes, "Hash bytes cannot be null");
        if (bytes.length != LENGTH) {
            throw new InvalidHashLengthException(LENGTH, bytes.length);
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Creates a Hash from a 32-byte buffer. The buffer is copied.
     *
     * @throws InvalidHashLengthException if {@code bytes.length != 32}
     */
    public static Hash fromBytes(byte[] bytes) {
        return new Hash(bytes);
    }

    /**
     * Parses 64 hex characters, optionally prefixed with {@code 0x} or {@code 0X}.
     * Upper- and lowercase digits are accepted.
     *
     * @throws InvalidHashHexException if the string is not hex or does not decode to 32 bytes
     */
    @JsonCreator(mode = JsonCreator.Mode.DELEGATING)
    public static Hash parse(String hex) {
        Objects.requireNonNull(hex, "hex string cannot be null");
        String digits = hex.startsWith("0x") || hex.startsWith("0X") ? hex.substring(2) : hex;

        byte[] decoded;
        try {
            decoded = HEX_FORMAT.parseHex(digits);
        } catch (IllegalArgumentException e) {
            throw new InvalidHashHexException(
                "Invalid hash hex string (expected " + LENGTH + " bytes): " + abbreviate(hex), e
            );
        }
        if (decoded.length != LENGTH) {
            throw new InvalidHashHexException(
                "Invalid hash hex string: expected " + LENGTH + " bytes, got " + decoded.length + ": " + abbreviate(hex)
            );
        }
        return new Hash(decoded);
    }

    /**
     * Computes the SHA3-256 digest of {@code data}.
     *
     * @throws DigestComputationException if the digest primitive is unavailable or fails
     */
    public static Hash digest(byte[] data) {
        return digest(data, Digester.sha3());
    }

    /**
     * Computes the digest of {@code data} with the given primitive.
     * Collaborator failures are reported as {@link DigestComputationException}, never retried.
     */
    public static Hash digest(byte[] data, Digester digester) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(digester, "digester cannot be null");

        byte[] result;
        try {
            result = digester.digest(data);
        } catch (DigestComputationException e) {
            throw e;
        } catch (RuntimeException e) {
            log.debugf(e, "Digest failed: digester=%s, input=%d bytes", digester, data.length);
            throw new DigestComputationException("Failed to compute digest with " + digester, e);
        }

        if (result == null || result.length != LENGTH) {
            String got = result == null ? "null" : result.length + " bytes";
            log.debugf("Digest returned %s, expected %d bytes: digester=%s", got, LENGTH, digester);
            throw new DigestComputationException(
                "Digest primitive " + digester + " returned " + got + ", expected " + LENGTH + " bytes"
            );
        }
        return new Hash(result);
    }

    /**
     * Computes the SHA3-256 digest on {@code executor}.
     *
     * @see #digestAsync(byte[], Digester, Executor)
     */
    public static CompletableFuture<Hash> digestAsync(byte[] data, Executor executor) {
        return digestAsync(data, Digester.sha3(), executor);
    }

    /**
     * Computes the digest of {@code data} with the given primitive on {@code executor}.
     * {@code data} is copied before this method returns; later mutation does not affect the result.
     * On failure the future completes exceptionally with the {@link DigestComputationException}
     * that {@link #digest(byte[], Digester)} would throw.
     */
    public static CompletableFuture<Hash> digestAsync(byte[] data, Digester digester, Executor executor) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(digester, "digester cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        byte[] snapshot = Arrays.copyOf(data, data.length);
        return CompletableFuture.supplyAsync(() -> digest(snapshot, digester), executor);
    }

    /**
     * Returns a fresh copy of the 32 hash bytes.
     */
    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns lowercase hex representation (64 characters, no prefix).
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    /**
     * Abbreviated form for logs: first 6 and last 6 hex characters, e.g. {@code 3338be...98f392}.
     * Lossy; never parse it.
     */
    public String toShortString() {
        String hex = toHex();
        return hex.substring(0, SHORT_PREFIX) + "..." + hex.substring(hex.length() - SHORT_PREFIX);
    }

    @JsonValue
    public String toJson() {
        return toHex();
    }

    /**
     * Unsigned lexicographic order from byte 0.
     *
     * @return -1, 0 or 1
     */
    @Override
    public int compareTo(Hash other) {
        Objects.requireNonNull(other, "other cannot be null");
        return Integer.signum(Arrays.compareUnsigned(bytes, other.bytes));
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof Hash other)) return false;

        // No early exit: every byte pair is examined.
        int diff = 0;
        for (int i = 0; i < LENGTH; i++) {
            diff |= bytes[i] ^ other.bytes[i];
        }
        return diff == 0;
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return toHex();
    }

    private static String abbreviate(String input) {
        if (input.length() <= MAX_ECHOED_INPUT) {
            return input;
        }
        return input.substring(0, MAX_ECHOED_INPUT) + "... (" + input.length() + " chars)";
    }
}
