package com.libragraph.peprobe.characterize.fuzzy;

/**
 * Thrown when the similarity-hash capability cannot fingerprint a byte range:
 * input too small or degenerate for the scheme, or resource exhaustion.
 *
 * <p>Callers should record the fingerprint as unknown, not treat it as a property of the content.
 * Failures depend on input shape, so retrying the same range is pointless.
 */
public class FingerprintUnavailableException extends RuntimeException {

    private final String scheme;
    private final int inputSize;

    public FingerprintUnavailableException(String scheme, int inputSize, Throwable cause) {
        super("Fuzzy fingerprint unavailable: scheme=" + scheme + " size=" + inputSize
                + (cause != null && cause.getMessage() != null ? " (" + cause.getMessage() + ")" : ""), cause);
        this.scheme = scheme;
        this.inputSize = inputSize;
    }

    public String scheme() {
        return scheme;
    }

    public int inputSize() {
        return inputSize;
    }
}
