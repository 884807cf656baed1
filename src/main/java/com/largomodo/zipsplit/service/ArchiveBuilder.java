package com.largomodo.zipsplit.service;

import com.largomodo.zipsplit.core.buffer.BufferSource;
import com.largomodo.zipsplit.core.domain.SourceFile;

import java.io.IOException;
import java.util.List;

/**
 * Service interface for compressing the files of one part into a staging buffer.
 */
public interface ArchiveBuilder {
    /**
     * Compresses each file, in order, into {@code buffer} as a complete archive.
     * The buffer is not disposed; ownership stays with the caller.
     *
     * @param files  files of the part in enumeration order
     * @param buffer empty buffer receiving the archive bytes
     * @throws IOException if any file cannot be read or the buffer cannot be written
     */
    void build(List<SourceFile> files, BufferSource buffer) throws IOException;
}
