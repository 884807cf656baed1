package com.largomodo.zipsplit.core.buffer;

import java.io.IOException;
import java.io.OutputStream;
import java.util.Arrays;

/**
 * Buffer held in a growable in-process byte array.
 * <p>
 * Capacity is bounded by the largest array the JVM can allocate. Writes beyond
 * {@link #MAX_CAPACITY} fail with an IOException rather than an OutOfMemoryError,
 * so the caller can report the part as failed and clean up normally.
 */
public class MemoryBufferSource implements BufferSource {

    /** Largest array size that is safe to request on common JVMs. */
    public static final int MAX_CAPACITY = Integer.MAX_VALUE - 8;

    private static final int INITIAL_CAPACITY = 64 * 1024;

    private byte[] data = new byte[INITIAL_CAPACITY];
    private int count;
    private boolean disposed;

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        ensureOpen();
        if (length > MAX_CAPACITY - count) {
            throw new IOException("In-memory buffer capacity exceeded: " + count + " + " + length
                    + " bytes > " + MAX_CAPACITY + " bytes");
        }
        ensureCapacity(count + length);
        System.arraycopy(bytes, offset, data, count, length);
        count += length;
    }

    @Override
    public byte[] readAll() {
        ensureOpen();
        return Arrays.copyOf(data, count);
    }

    @Override
    public long transferTo(OutputStream target) throws IOException {
        ensureOpen();
        target.write(data, 0, count);
        return count;
    }

    @Override
    public long size() {
        return count;
    }

    @Override
    public boolean isDiskBacked() {
        return false;
    }

    @Override
    public void dispose() {
        // No external resource: dropping the array is all there is to release
        disposed = true;
        data = new byte[0];
        count = 0;
    }

    private void ensureCapacity(int required) {
        if (required <= data.length) {
            return;
        }
        long doubled = (long) data.length * 2;
        int newCapacity = (int) Math.min(Math.max(doubled, required), MAX_CAPACITY);
        data = Arrays.copyOf(data, newCapacity);
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("Memory buffer has been disposed");
        }
    }
}
