package com.libragraph.peprobe.util;

import com.libragraph.peprobe.types.DigestAlgorithm;

import java.util.Arrays;
import java.util.HexFormat;
import java.util.Objects;

/**
 * Digest of a byte range under one {@link DigestAlgorithm}.
 * Immutable value object that can be used as a map key.
 */
public record ContentDigest(DigestAlgorithm algorithm, byte[] bytes) {
    private static final HexFormat HEX_FORMAT = HexFormat.of();

    public ContentDigest {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(bytes, "Digest bytes cannot be null");
        if (bytes.length != algorithm.digestLength()) {
            throw new IllegalArgumentException(
                algorithm + " digest must be " + algorithm.digestLength() + " bytes, got: " + bytes.length
            );
        }
        bytes = Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Parses a hex digest for the given algorithm. Upper and lower case are accepted.
     */
    public static ContentDigest fromHex(DigestAlgorithm algorithm, String hex) {
        Objects.requireNonNull(algorithm, "algorithm cannot be null");
        Objects.requireNonNull(hex, "hex string cannot be null");
        if (hex.length() != algorithm.hexLength()) {
            throw new IllegalArgumentException(
                algorithm + " hex string must be " + algorithm.hexLength() + " characters, got: " + hex.length()
            );
        }
        try {
            return new ContentDigest(algorithm, HEX_FORMAT.parseHex(hex));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid hex string: " + hex, e);
        }
    }

    @Override
    public byte[] bytes() {
        return Arrays.copyOf(bytes, bytes.length);
    }

    /**
     * Returns the lowercase hex representation.
     */
    public String toHex() {
        return HEX_FORMAT.formatHex(bytes);
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) return true;
        if (!(obj instanceof ContentDigest other)) return false;
        return algorithm == other.algorithm && Arrays.equals(bytes, other.bytes);
    }

    @Override
    public int hashCode() {
        return 31 * algorithm.hashCode() + Arrays.hashCode(bytes);
    }

    @Override
    public String toString() {
        return algorithm.label() + ":" + toHex();
    }
}
