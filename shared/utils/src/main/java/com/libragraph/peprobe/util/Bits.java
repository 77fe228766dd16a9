package com.libragraph.peprobe.util;

/**
 * Bit-twiddling helpers for header field checks.
 */
public final class Bits {

    private Bits() {
    }

    /**
     * Whether {@code value} is a power of two. Zero is not; values are treated as unsigned.
     */
    public static boolean isPowerOfTwo(long value) {
        return value != 0 && (value & (value - 1)) == 0;
    }

    /**
     * Unsigned 32-bit overload, for alignment fields read as {@code int}.
     */
    public static boolean isPowerOfTwo(int value) {
        return isPowerOfTwo(Integer.toUnsignedLong(value));
    }
}
