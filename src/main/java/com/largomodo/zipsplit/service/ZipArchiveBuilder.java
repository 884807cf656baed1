package com.largomodo.zipsplit.service;

import com.largomodo.zipsplit.core.buffer.BufferSource;
import com.largomodo.zipsplit.core.domain.SourceFile;
import org.apache.commons.compress.archivers.zip.Zip64Mode;
import org.apache.commons.compress.archivers.zip.ZipArchiveEntry;
import org.apache.commons.compress.archivers.zip.ZipArchiveOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.Files;
import java.util.List;
import java.util.zip.Deflater;

/**
 * ZIP implementation of {@link ArchiveBuilder} using Commons Compress.
 * <p>
 * Entries are deflated at {@link Deflater#BEST_COMPRESSION} and named with each
 * file's relative name. Duplicate names are written as-is; no renaming is attempted.
 * <p>
 * The declared entry size comes from the scanned file size so that Zip64 extra
 * fields are emitted for entries over 4 GiB on a non-seekable stream. A file that
 * changes size between scanning and compression fails the part.
 */
public class ZipArchiveBuilder implements ArchiveBuilder {

    private static final Logger log = LoggerFactory.getLogger(ZipArchiveBuilder.class);

    private final int compressionLevel;

    public ZipArchiveBuilder() {
        this(Deflater.BEST_COMPRESSION);
    }

    /**
     * @param compressionLevel deflate level, 0-9
     */
    ZipArchiveBuilder(int compressionLevel) {
        if (compressionLevel < Deflater.NO_COMPRESSION || compressionLevel > Deflater.BEST_COMPRESSION) {
            throw new IllegalArgumentException("Compression level must be 0-9, got: " + compressionLevel);
        }
        this.compressionLevel = compressionLevel;
    }

    @Override
    public void build(List<SourceFile> files, BufferSource buffer) throws IOException {
        if (files == null || buffer == null) {
            throw new IllegalArgumentException("Files and buffer must not be null");
        }

        OutputStream bufferStream = buffer.openOutputStream();
        try (ZipArchiveOutputStream zip = new ZipArchiveOutputStream(bufferStream)) {
            zip.setLevel(compressionLevel);
            zip.setMethod(ZipArchiveOutputStream.DEFLATED);
            zip.setUseZip64(Zip64Mode.AsNeeded);

            for (SourceFile file : files) {
                ZipArchiveEntry entry = new ZipArchiveEntry(file.relativeName());
                entry.setSize(file.sizeBytes());
                entry.setTime(Files.getLastModifiedTime(file.absolutePath()).toMillis());

                zip.putArchiveEntry(entry);
                Files.copy(file.absolutePath(), zip);
                zip.closeArchiveEntry();

                log.debug("Added entry {} ({} bytes)", file.relativeName(), file.sizeBytes());
            }

            zip.finish();
        }
    }
}
