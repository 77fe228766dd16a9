package com.libragraph.peprobe.characterize.fuzzy;

import com.trendmicro.tlsh.TlshCreator;
import jakarta.enterprise.context.ApplicationScoped;

import java.nio.ByteBuffer;

/**
 * {@link FuzzyHasher} backed by TLSH (Trend Micro Locality Sensitive Hash).
 *
 * <p>TLSH needs at least 50 bytes with enough byte-value variance; anything less makes
 * {@link TlshCreator#getHash()} throw {@link IllegalStateException}.
 */
@ApplicationScoped
public class TlshFuzzyHasher implements FuzzyHasher {

    public static final String SCHEME = "tlsh";

    /** Input is streamed through a scratch array of at most this size, whatever the backing. */
    private static final int CHUNK_SIZE = 8192;

    @Override
    public String scheme() {
        return SCHEME;
    }

    @Override
    public String hash(ByteBuffer data) {
        TlshCreator creator = new TlshCreator();

        byte[] chunk = new byte[Math.min(CHUNK_SIZE, data.remaining())];
        while (data.hasRemaining()) {
            int n = Math.min(chunk.length, data.remaining());
            data.get(chunk, 0, n);
            creator.update(chunk, 0, n);
        }

        return creator.getHash().getEncoded();
    }
}
