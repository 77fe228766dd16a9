package com.libragraph.peprobe.util.buffer;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.Objects;

/**
 * Read-only, borrowed view over a byte range backed by a heap array, an existing
 * {@link ByteBuffer}, or a memory-mapped file.
 *
 * <p>Views never copy the underlying bytes: {@link #slice(int, int)} and {@link #buffer()}
 * share storage with the source. Callers that still hold a writable reference to the source
 * must not mutate it while a view is in use.
 *
 * <p>Instances are immutable and safe to share across threads. Every consumer gets its own
 * position/limit through {@link #buffer()}.
 */
public final class ByteView {

    private static final ByteView EMPTY = new ByteView(ByteBuffer.allocate(0).asReadOnlyBuffer());

    /** Read-only, position 0, limit == size. Never handed out directly. */
    private final ByteBuffer data;

    private ByteView(ByteBuffer data) {
        this.data = data;
    }

    public static ByteView empty() {
        return EMPTY;
    }

    /**
     * Wraps a whole array without copying.
     */
    public static ByteView wrap(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        return new ByteView(ByteBuffer.wrap(bytes).asReadOnlyBuffer());
    }

    /**
     * Wraps {@code length} bytes of an array starting at {@code offset}, without copying.
     */
    public static ByteView wrap(byte[] bytes, int offset, int length) {
        Objects.requireNonNull(bytes, "bytes cannot be null");
        Objects.checkFromIndexSize(offset, length, bytes.length);
        return new ByteView(ByteBuffer.wrap(bytes, offset, length).slice().asReadOnlyBuffer());
    }

    /**
     * Wraps the remaining bytes of {@code buffer} (position to limit).
     * The buffer's own position and limit are left untouched.
     */
    public static ByteView wrap(ByteBuffer buffer) {
        Objects.requireNonNull(buffer, "buffer cannot be null");
        return new ByteView(buffer.slice().asReadOnlyBuffer());
    }

    /**
     * Maps a whole file read-only. The mapping stays valid after this method returns;
     * it is released when the view becomes unreachable.
     *
     * @throws IOException if the file cannot be opened or mapped
     * @throws IllegalArgumentException if the file is larger than 2 GiB
     */
    public static ByteView map(Path path) throws IOException {
        Objects.requireNonNull(path, "path cannot be null");
        try (FileChannel channel = FileChannel.open(path, StandardOpenOption.READ)) {
            long size = channel.size();
            if (size > Integer.MAX_VALUE) {
                throw new IllegalArgumentException("File too large to map as one view: " + path + " (" + size + " bytes)");
            }
            if (size == 0) {
                return EMPTY;
            }
            return new ByteView(channel.map(FileChannel.MapMode.READ_ONLY, 0, size));
        }
    }

    /**
     * Total size in bytes.
     */
    public int size() {
        return data.limit();
    }

    public boolean isEmpty() {
        return data.limit() == 0;
    }

    /**
     * Returns the byte at {@code index} as an unsigned value (0-255).
     */
    public int byteAt(int index) {
        Objects.checkIndex(index, data.limit());
        return data.get(index) & 0xFF;
    }

    /**
     * Zero-copy sub-range, e.g. a section's raw data inside a mapped image.
     *
     * @throws IndexOutOfBoundsException if the range falls outside this view
     */
    public ByteView slice(int offset, int length) {
        Objects.checkFromIndexSize(offset, length, data.limit());
        if (offset == 0 && length == data.limit()) {
            return this;
        }
        ByteBuffer dup = data.duplicate();
        dup.position(offset).limit(offset + length);
        return new ByteView(dup.slice());
    }

    /**
     * Fresh read-only buffer over this view, positioned at 0.
     * The caller may consume it freely; other consumers are unaffected.
     */
    public ByteBuffer buffer() {
        return data.duplicate();
    }

    /**
     * Copies the view into a new array. Intended for small ranges such as name tokens.
     */
    public byte[] toByteArray() {
        byte[] copy = new byte[data.limit()];
        data.duplicate().get(copy);
        return copy;
    }

    @Override
    public String toString() {
        return "ByteView[size=" + size() + (data.isDirect() ? ", direct" : "") + "]";
    }
}
