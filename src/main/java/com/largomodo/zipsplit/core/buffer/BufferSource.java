package com.largomodo.zipsplit.core.buffer;

import java.io.IOException;
import java.io.OutputStream;

/**
 * Staging area for the compressed bytes of one archive part.
 * <p>
 * A buffer is written sequentially (once per compressed entry), then rewound and
 * read back in full. It is owned by a single part and disposed as soon as that
 * part has been flushed to its output file. Implementations either hold the bytes
 * in memory or spill them to a temporary file.
 * <p>
 * {@link #close()} delegates to {@link #dispose()} so buffers can be used with
 * try-with-resources. Disposing twice is a no-op.
 *
 * @see BufferSelector
 */
public interface BufferSource extends AutoCloseable {

    /**
     * Appends bytes to the end of the buffer.
     *
     * @throws IOException           if the bytes cannot be stored
     * @throws IllegalStateException if the buffer has been disposed
     */
    void write(byte[] bytes, int offset, int length) throws IOException;

    default void write(byte[] bytes) throws IOException {
        write(bytes, 0, bytes.length);
    }

    /**
     * Rewinds to offset 0 and returns the complete contents.
     *
     * @throws IOException if the contents cannot be read or do not fit in a byte array
     */
    byte[] readAll() throws IOException;

    /**
     * Rewinds to offset 0 and streams the complete contents to {@code target}.
     * Unlike {@link #readAll()} this works for buffers larger than 2 GiB.
     *
     * @return number of bytes copied
     */
    long transferTo(OutputStream target) throws IOException;

    /**
     * @return number of bytes written so far
     */
    long size() throws IOException;

    /**
     * @return true if the bytes are staged in a temporary file
     */
    boolean isDiskBacked();

    /**
     * Releases the buffer and any external resource behind it.
     *
     * @throws BufferCleanupException if a temporary file exists but cannot be deleted
     */
    void dispose();

    @Override
    default void close() {
        dispose();
    }

    /**
     * Returns a stream view whose writes go to {@link #write(byte[], int, int)}.
     * Closing the stream does not dispose the buffer.
     */
    default OutputStream openOutputStream() {
        return new OutputStream() {
            @Override
            public void write(int b) throws IOException {
                BufferSource.this.write(new byte[]{(byte) b}, 0, 1);
            }

            @Override
            public void write(byte[] b, int off, int len) throws IOException {
                BufferSource.this.write(b, off, len);
            }
        };
    }
}
