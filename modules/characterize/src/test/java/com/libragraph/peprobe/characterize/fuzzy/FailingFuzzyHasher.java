package com.libragraph.peprobe.characterize.fuzzy;

import java.nio.ByteBuffer;
import java.util.function.Supplier;

/**
 * Test double that fails every call with the supplied error.
 */
public class FailingFuzzyHasher implements FuzzyHasher {

    private final Supplier<? extends Throwable> failure;

    public FailingFuzzyHasher(Supplier<? extends Throwable> failure) {
        this.failure = failure;
    }

    @Override
    public String scheme() {
        return "failing";
    }

    @Override
    public String hash(ByteBuffer data) {
        Throwable t = failure.get();
        if (t instanceof RuntimeException re) throw re;
        if (t instanceof Error err) throw err;
        throw new IllegalStateException(t);
    }
}
