package com.libragraph.peprobe.characterize.profile;

import com.libragraph.peprobe.characterize.fuzzy.FuzzyDigest;
import com.libragraph.peprobe.types.DigestAlgorithm;
import com.libragraph.peprobe.util.ContentDigest;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Characterization of one byte range (a section, an overlay, a whole image).
 *
 * @param size    range length in bytes
 * @param entropy Shannon entropy in bits per byte, 0-8
 * @param digests digests per configured algorithm
 * @param fuzzy   similarity fingerprint, empty when unavailable or skipped
 */
public record ContentProfile(
        int size,
        double entropy,
        Map<DigestAlgorithm, ContentDigest> digests,
        Optional<FuzzyDigest> fuzzy
) {
    public ContentProfile {
        Objects.requireNonNull(digests, "digests cannot be null");
        Objects.requireNonNull(fuzzy, "fuzzy cannot be null");
        digests = digests.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new EnumMap<>(digests));
    }

    /**
     * Hex digest for {@code algorithm}, if it was computed.
     */
    public Optional<String> hex(DigestAlgorithm algorithm) {
        return Optional.ofNullable(digests.get(algorithm)).map(ContentDigest::toHex);
    }
}
