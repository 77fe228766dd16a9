package com.libragraph.peprobe.characterize.fuzzy;

import com.libragraph.peprobe.util.buffer.ByteView;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;

import java.util.Objects;

/**
 * Computes similarity fingerprints through an injected {@link FuzzyHasher}.
 *
 * <p>The range is passed as a read-only duplicate of the view, never copied. Every failure of
 * the capability, including allocation failure and blank output, surfaces as
 * {@link FingerprintUnavailableException} with the original cause attached.
 */
@ApplicationScoped
public class FuzzyFingerprintAdapter {

    private static final Logger log = Logger.getLogger(FuzzyFingerprintAdapter.class);

    @Inject
    FuzzyHasher hasher;

    FuzzyFingerprintAdapter() {
    }

    public FuzzyFingerprintAdapter(FuzzyHasher hasher) {
        this.hasher = Objects.requireNonNull(hasher, "hasher cannot be null");
    }

    /**
     * @throws FingerprintUnavailableException if the capability cannot produce a fingerprint
     */
    public FuzzyDigest fingerprint(ByteView data) {
        Objects.requireNonNull(data, "data cannot be null");

        String value;
        try {
            value = hasher.hash(data.buffer());
        } catch (RuntimeException | OutOfMemoryError e) {
            log.debugf("%s fingerprint failed for %d bytes: %s", hasher.scheme(), data.size(), e);
            throw new FingerprintUnavailableException(hasher.scheme(), data.size(), e);
        }

        if (value == null || value.isBlank()) {
            throw new FingerprintUnavailableException(hasher.scheme(), data.size(),
                    new IllegalStateException("Capability returned no fingerprint"));
        }
        return new FuzzyDigest(hasher.scheme(), value);
    }

    public String scheme() {
        return hasher.scheme();
    }
}
