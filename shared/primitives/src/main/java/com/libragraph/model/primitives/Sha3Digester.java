package com.libragraph.model.primitives;

import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.codec.digest.MessageDigestAlgorithms;

/**
 * SHA3-256 via Commons Codec over the JDK {@code MessageDigest} provider.
 * A fresh {@code MessageDigest} is obtained per call, so one instance serves all threads.
 */
final class Sha3Digester implements Digester {

    static final String ALGORITHM = MessageDigestAlgorithms.SHA3_256;
    static final Sha3Digester INSTANCE = new Sha3Digester();

    private Sha3Digester() {
    }

    @Override
    public byte[] digest(byte[] data) {
        return DigestUtils.sha3_256(data);
    }

    @Override
    public String toString() {
        return ALGORITHM;
    }
}
