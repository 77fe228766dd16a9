package com.libragraph.peprobe.characterize.fuzzy;

import java.nio.ByteBuffer;

/**
 * External similarity-hash capability.
 *
 * <p>Implementations compute a fingerprint whose distance to another fingerprint tracks
 * how similar the inputs are. They may fail on input the scheme cannot handle (too short,
 * too little variance) by throwing any runtime exception; {@link FuzzyFingerprintAdapter}
 * classifies those failures.
 *
 * <p>Implementations must be stateless and thread-safe.
 */
public interface FuzzyHasher {

    /**
     * Short scheme identifier, e.g. {@code "tlsh"}.
     */
    String scheme();

    /**
     * Computes the fingerprint of the remaining bytes of {@code data}.
     * The buffer is read-only and owned by the caller's call; it may be consumed.
     */
    String hash(ByteBuffer data);
}
