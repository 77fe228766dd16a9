package com.libragraph.peprobe.characterize.entropy;

import com.libragraph.peprobe.util.buffer.ByteView;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.ByteBuffer;

/**
 * Shannon entropy of a byte range, in bits per byte.
 *
 * <p>Packed, compressed or encrypted sections sit close to 8; code and data sections
 * usually fall well below 7. Empty input yields 0.
 */
@ApplicationScoped
public class EntropyMeter {

    public static final double MAX_ENTROPY = 8.0;

    private static final double LN_2 = Math.log(2);

    public double entropy(ByteView data) {
        if (data.isEmpty()) {
            return 0.0;
        }

        long[] occurrences = new long[256];
        ByteBuffer buf = data.buffer();
        int length = buf.limit();
        for (int i = 0; i < length; i++) {
            occurrences[buf.get(i) & 0xFF]++;
        }

        double entropy = 0.0;
        for (long occurrence : occurrences) {
            if (occurrence > 0) {
                double px = (double) occurrence / length;
                entropy -= px * (Math.log(px) / LN_2);
            }
        }

        // Rounding can push a uniform distribution a few ulps past the bound
        return Math.min(MAX_ENTROPY, Math.max(0.0, entropy));
    }

    public double entropy(byte[] data) {
        return entropy(ByteView.wrap(data));
    }

    public boolean isHighEntropy(ByteView data, double threshold) {
        return entropy(data) >= threshold;
    }
}
