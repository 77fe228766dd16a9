package com.libragraph.peprobe.characterize.profile;

import com.libragraph.peprobe.characterize.digest.DigestComputer;
import com.libragraph.peprobe.characterize.entropy.EntropyMeter;
import com.libragraph.peprobe.characterize.fuzzy.FingerprintUnavailableException;
import com.libragraph.peprobe.characterize.fuzzy.FuzzyDigest;
import com.libragraph.peprobe.characterize.fuzzy.FuzzyFingerprintAdapter;
import com.libragraph.peprobe.types.DigestAlgorithm;
import com.libragraph.peprobe.util.buffer.ByteView;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;

import java.util.EnumSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every primitive over one byte range.
 *
 * <p>A missing fuzzy fingerprint never fails the profile: it is recorded as absent.
 * Ranges above {@code peprobe.profile.fuzzy.max-bytes} skip fuzzy hashing to bound latency.
 */
@ApplicationScoped
public class ContentProfiler {

    private static final Logger log = Logger.getLogger(ContentProfiler.class);

    @Inject
    EntropyMeter entropyMeter;

    @Inject
    DigestComputer digestComputer;

    @Inject
    FuzzyFingerprintAdapter fuzzyAdapter;

    @ConfigProperty(name = "peprobe.profile.digests", defaultValue = "md5,sha1,sha256")
    List<String> digests;

    @ConfigProperty(name = "peprobe.profile.fuzzy.enabled", defaultValue = "true")
    boolean fuzzyEnabled;

    @ConfigProperty(name = "peprobe.profile.fuzzy.max-bytes", defaultValue = "67108864")
    long fuzzyMaxBytes;

    private Set<DigestAlgorithm> algorithms;

    ContentProfiler() {
    }

    /**
     * Wires the profiler by hand, outside a CDI container.
     */
    public ContentProfiler(
            EntropyMeter entropyMeter,
            DigestComputer digestComputer,
            FuzzyFingerprintAdapter fuzzyAdapter,
            List<String> digests,
            boolean fuzzyEnabled,
            long fuzzyMaxBytes) {
        this.entropyMeter = Objects.requireNonNull(entropyMeter, "entropyMeter cannot be null");
        this.digestComputer = Objects.requireNonNull(digestComputer, "digestComputer cannot be null");
        this.fuzzyAdapter = Objects.requireNonNull(fuzzyAdapter, "fuzzyAdapter cannot be null");
        this.digests = digests;
        this.fuzzyEnabled = fuzzyEnabled;
        this.fuzzyMaxBytes = fuzzyMaxBytes;
        init();
    }

    @PostConstruct
    void init() {
        if (fuzzyMaxBytes < 0) {
            throw new IllegalArgumentException("peprobe.profile.fuzzy.max-bytes must be >= 0, got: " + fuzzyMaxBytes);
        }
        algorithms = parseAlgorithms(digests);
        log.debugf("ContentProfiler digests=%s fuzzy=%s (scheme=%s, max %d bytes)",
                algorithms, fuzzyEnabled, fuzzyAdapter.scheme(), fuzzyMaxBytes);
    }

    public ContentProfile profile(ByteView data) {
        Objects.requireNonNull(data, "data cannot be null");

        double entropy = entropyMeter.entropy(data);
        var digestsByAlgorithm = digestComputer.digestAll(data, algorithms);
        return new ContentProfile(data.size(), entropy, digestsByAlgorithm, fuzzy(data));
    }

    public Set<DigestAlgorithm> algorithms() {
        return algorithms.isEmpty() ? EnumSet.noneOf(DigestAlgorithm.class) : EnumSet.copyOf(algorithms);
    }

    public boolean fuzzyEnabled() {
        return fuzzyEnabled;
    }

    public long fuzzyMaxBytes() {
        return fuzzyMaxBytes;
    }

    private Optional<FuzzyDigest> fuzzy(ByteView data) {
        if (!fuzzyEnabled) {
            return Optional.empty();
        }
        if (data.size() > fuzzyMaxBytes) {
            log.debugf("Skipping fuzzy fingerprint: %d bytes exceeds limit of %d", (Object) data.size(), fuzzyMaxBytes);
            return Optional.empty();
        }
        try {
            return Optional.of(fuzzyAdapter.fingerprint(data));
        } catch (FingerprintUnavailableException e) {
            log.debugf(e, "Fuzzy fingerprint recorded as absent for %d bytes", (Object) data.size());
            return Optional.empty();
        }
    }

    private static Set<DigestAlgorithm> parseAlgorithms(List<String> labels) {
        Set<DigestAlgorithm> parsed = EnumSet.noneOf(DigestAlgorithm.class);
        if (labels != null) {
            for (String label : labels) {
                if (!label.isBlank()) {
                    parsed.add(DigestAlgorithm.fromLabel(label));
                }
            }
        }
        return parsed;
    }
}
