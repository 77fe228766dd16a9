package com.libragraph.peprobe.characterize.digest;

import com.libragraph.peprobe.types.DigestAlgorithm;
import com.libragraph.peprobe.util.ContentDigest;
import com.libragraph.peprobe.util.buffer.ByteView;
import jakarta.enterprise.context.ApplicationScoped;
import org.apache.commons.codec.digest.DigestUtils;

import java.security.MessageDigest;
import java.util.Collection;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Cryptographic digests of byte ranges for exact-match identification.
 *
 * <p>A fresh {@link MessageDigest} is created per call, so the bean is safe to share.
 */
@ApplicationScoped
public class DigestComputer {

    /**
     * Digests the whole range in a single update.
     */
    public ContentDigest digest(ByteView data, DigestAlgorithm algorithm) {
        Objects.requireNonNull(data, "data cannot be null");
        Objects.requireNonNull(algorithm, "algorithm cannot be null");

        MessageDigest md = DigestUtils.getDigest(algorithm.jcaName());
        DigestUtils.updateDigest(md, data.buffer());
        return new ContentDigest(algorithm, md.digest());
    }

    /**
     * Lowercase hex digest of the range.
     */
    public String hex(ByteView data, DigestAlgorithm algorithm) {
        return digest(data, algorithm).toHex();
    }

    public String hex(byte[] data, DigestAlgorithm algorithm) {
        return hex(ByteView.wrap(data), algorithm);
    }

    /**
     * Digests the range once per requested algorithm. Entries come back in enum order.
     */
    public Map<DigestAlgorithm, ContentDigest> digestAll(ByteView data, Collection<DigestAlgorithm> algorithms) {
        Map<DigestAlgorithm, ContentDigest> digests = new EnumMap<>(DigestAlgorithm.class);
        for (DigestAlgorithm algorithm : algorithms) {
            digests.put(algorithm, digest(data, algorithm));
        }
        return digests;
    }
}
