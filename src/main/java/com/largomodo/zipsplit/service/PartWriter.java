package com.largomodo.zipsplit.service;

import com.largomodo.zipsplit.core.buffer.BufferSource;
import com.largomodo.zipsplit.core.domain.OutputArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Flushes a finished part buffer to its numbered archive file.
 * <p>
 * The buffer is always disposed, whether the copy succeeds or not. A partially
 * written archive is deleted before the failure propagates, so the output
 * directory only ever holds complete parts.
 * <p>
 * The output directory must already exist.
 */
public class PartWriter {

    private static final Logger log = LoggerFactory.getLogger(PartWriter.class);

    /**
     * Copies the buffer contents to {@code outputDir/archive_partNNN.zip} and disposes the buffer.
     *
     * @param partIndex   zero-based part number used in the file name
     * @param builtBuffer buffer holding a complete archive
     * @param outputDir   existing destination directory
     * @return the written artifact
     * @throws IOException if the archive file cannot be written
     */
    public OutputArtifact writePart(int partIndex, BufferSource builtBuffer, Path outputDir) throws IOException {
        Path target = outputDir.resolve(OutputArtifact.fileNameFor(partIndex));

        try (BufferSource buffer = builtBuffer) {
            if (Files.exists(target)) {
                log.warn("Overwriting existing file: {}", target);
            }

            long written;
            try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(target,
                    StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {
                written = buffer.transferTo(out);
            } catch (IOException e) {
                try {
                    Files.deleteIfExists(target);
                } catch (IOException deleteEx) {
                    e.addSuppressed(deleteEx);
                }
                throw e;
            }

            return new OutputArtifact(partIndex, target, written);
        }
    }
}
