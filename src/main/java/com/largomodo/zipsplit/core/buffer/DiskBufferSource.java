package com.largomodo.zipsplit.core.buffer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.channels.Channels;
import java.nio.channels.FileChannel;
import java.nio.channels.WritableByteChannel;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Buffer backed by a uniquely named temporary file.
 * <p>
 * The file is created and opened read+write on construction. Writes append at the
 * current end; reads always start from offset 0. {@link #dispose()} closes the
 * channel and deletes the file, treating an already missing file as deleted.
 * <p>
 * Files orphaned by a killed JVM are not reclaimed; they carry the
 * {@value #TEMP_FILE_PREFIX} prefix so they are easy to find.
 */
public class DiskBufferSource implements BufferSource {

    static final String TEMP_FILE_PREFIX = "zipsplit-";
    static final String TEMP_FILE_SUFFIX = ".part";

    private static final Logger log = LoggerFactory.getLogger(DiskBufferSource.class);

    private final Path tempFile;
    private final FileChannel channel;
    private boolean disposed;

    /**
     * Creates a buffer file in {@code tempDir}, or in the platform temp directory when null.
     *
     * @throws IOException if the temp file cannot be created or opened
     */
    public DiskBufferSource(Path tempDir) throws IOException {
        this.tempFile = tempDir == null
                ? Files.createTempFile(TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX)
                : Files.createTempFile(tempDir, TEMP_FILE_PREFIX, TEMP_FILE_SUFFIX);
        try {
            this.channel = FileChannel.open(tempFile, StandardOpenOption.READ, StandardOpenOption.WRITE);
        } catch (IOException e) {
            try {
                Files.deleteIfExists(tempFile);
            } catch (IOException deleteEx) {
                e.addSuppressed(deleteEx);
            }
            throw e;
        }
        log.debug("Created disk buffer: {}", tempFile);
    }

    /**
     * @return location of the backing temporary file
     */
    public Path getTempFile() {
        return tempFile;
    }

    @Override
    public void write(byte[] bytes, int offset, int length) throws IOException {
        ensureOpen();
        ByteBuffer src = ByteBuffer.wrap(bytes, offset, length);
        long position = channel.size();
        while (src.hasRemaining()) {
            position += channel.write(src, position);
        }
    }

    @Override
    public byte[] readAll() throws IOException {
        ensureOpen();
        long size = channel.size();
        if (size > MemoryBufferSource.MAX_CAPACITY) {
            throw new IOException("Disk buffer too large to read into memory: " + size + " bytes");
        }
        ByteBuffer dst = ByteBuffer.allocate((int) size);
        long position = 0;
        while (dst.hasRemaining()) {
            int read = channel.read(dst, position);
            if (read < 0) {
                throw new IOException("Unexpected end of disk buffer at " + position + " of " + size + " bytes");
            }
            position += read;
        }
        return dst.array();
    }

    @Override
    public long transferTo(OutputStream target) throws IOException {
        ensureOpen();
        long size = channel.size();
        // Channel wrapper is not closed: closing it would close the caller's stream
        WritableByteChannel out = Channels.newChannel(target);
        long position = 0;
        while (position < size) {
            long transferred = channel.transferTo(position, size - position, out);
            if (transferred <= 0) {
                throw new IOException("Disk buffer transfer stalled at " + position + " of " + size + " bytes");
            }
            position += transferred;
        }
        return size;
    }

    @Override
    public long size() throws IOException {
        ensureOpen();
        return channel.size();
    }

    @Override
    public boolean isDiskBacked() {
        return true;
    }

    @Override
    public void dispose() {
        if (disposed) {
            return;
        }
        disposed = true;

        IOException closeFailure = null;
        try {
            channel.close();
        } catch (IOException e) {
            closeFailure = e;
        }

        try {
            Files.deleteIfExists(tempFile);
            log.debug("Deleted disk buffer: {}", tempFile);
        } catch (IOException e) {
            if (closeFailure != null) {
                e.addSuppressed(closeFailure);
            }
            throw new BufferCleanupException("Failed to delete disk buffer: " + tempFile, e);
        }

        if (closeFailure != null) {
            // File is gone, so a failed close leaks nothing on disk
            log.warn("Failed to close disk buffer channel: {}", tempFile, closeFailure);
        }
    }

    private void ensureOpen() {
        if (disposed) {
            throw new IllegalStateException("Disk buffer has been disposed: " + tempFile);
        }
    }
}
