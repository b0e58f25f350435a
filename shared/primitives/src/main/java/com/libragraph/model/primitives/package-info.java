/**
 * Core value types of the Libragraph model.
 *
 * <p>Contains {@link com.libragraph.model.primitives.Hash} (SHA3-256) and the
 * {@link com.libragraph.model.primitives.Digester} seam it hashes through.
 * No framework dependencies: Commons Codec for the digest, Jackson annotations
 * for the JSON form, JBoss Logging.
 */
package com.libragraph.model.primitives;
