package com.libragraph.peprobe.types;

/**
 * Cryptographic digest algorithms supported for exact-match identification.
 */
public enum DigestAlgorithm {
    MD5(0, "md5", "MD5", 16),
    SHA1(1, "sha1", "SHA-1", 20),
    SHA256(2, "sha256", "SHA-256", 32);

    private final int id;
    private final String label;
    private final String jcaName;
    private final int digestLength;

    DigestAlgorithm(int id, String label, String jcaName, int digestLength) {
        this.id = id;
        this.label = label;
        this.jcaName = jcaName;
        this.digestLength = digestLength;
    }

    public int id() {
        return id;
    }

    public String label() {
        return label;
    }

    /**
     * Standard algorithm name accepted by {@link java.security.MessageDigest#getInstance(String)}.
     */
    public String jcaName() {
        return jcaName;
    }

    /**
     * Raw digest length in bytes.
     */
    public int digestLength() {
        return digestLength;
    }

    /**
     * Length of the lowercase hex encoding (32, 40 or 64).
     */
    public int hexLength() {
        return digestLength * 2;
    }

    public static DigestAlgorithm fromId(int id) {
        for (DigestAlgorithm a : values()) {
            if (a.id == id) return a;
        }
        throw new IllegalArgumentException("Unknown DigestAlgorithm id: " + id);
    }

    /**
     * Resolves a label ("md5", "sha1", "sha256"), case-insensitive.
     * The JCA names ("SHA-256") are accepted too.
     */
    public static DigestAlgorithm fromLabel(String label) {
        String normalized = label.trim();
        for (DigestAlgorithm a : values()) {
            if (a.label.equalsIgnoreCase(normalized) || a.jcaName.equalsIgnoreCase(normalized)) {
                return a;
            }
        }
        throw new IllegalArgumentException("Unknown DigestAlgorithm label: " + label);
    }
}
