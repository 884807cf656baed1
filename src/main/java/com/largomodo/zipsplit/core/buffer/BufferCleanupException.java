package com.largomodo.zipsplit.core.buffer;

import java.io.IOException;

/**
 * Thrown when a disposed buffer cannot release its temporary file.
 * <p>
 * Unchecked so that {@link BufferSource#dispose()} can run from finally blocks and
 * try-with-resources; the underlying IOException is kept as the cause.
 */
public class BufferCleanupException extends RuntimeException {

    /**
     * @param message description of the buffer that failed to clean up
     * @param cause   the deletion failure
     */
    public BufferCleanupException(String message, IOException cause) {
        super(message, cause);
    }
}
