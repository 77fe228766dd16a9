package com.libragraph.peprobe.characterize.fuzzy;

import java.util.Objects;

/**
 * Similarity fingerprint produced by a {@link FuzzyHasher}.
 * Opaque: only comparable with digests of the same scheme.
 *
 * @param scheme identifier of the producing scheme (e.g. {@code "tlsh"})
 * @param value  printable fingerprint string
 */
public record FuzzyDigest(String scheme, String value) {

    public FuzzyDigest {
        Objects.requireNonNull(scheme, "scheme cannot be null");
        Objects.requireNonNull(value, "value cannot be null");
        if (value.isBlank()) {
            throw new IllegalArgumentException("Fuzzy digest value cannot be blank");
        }
    }

    @Override
    public String toString() {
        return value;
    }
}
